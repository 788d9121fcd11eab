// PointCloud.java

package com.openathena.insar.cloud;

import java.util.Arrays;

/**
 * Ordered points plus an index aligned attribute set.  Coordinates are kept
 * column-wise; the cloud is not modified after construction.
 */
public final class PointCloud
{
    private final double[] x, y, z;
    private final PointAttributeSet attributes;
    private final String crs;

    public PointCloud(double[] x, double[] y, double[] z, PointAttributeSet attributes, String crs)
    {
        if (x.length != y.length || x.length != z.length) {
            throw new IllegalArgumentException("Coordinate arrays differ in length: "
                                               + x.length + "/" + y.length + "/" + z.length);
        }
        if (attributes.size() != x.length) {
            throw new IllegalArgumentException("Attribute set covers " + attributes.size()
                                               + " points, cloud has " + x.length);
        }
        this.x = Arrays.copyOf(x, x.length);
        this.y = Arrays.copyOf(y, y.length);
        this.z = Arrays.copyOf(z, z.length);
        this.attributes = attributes;
        this.crs = (crs == null) ? "" : crs;
    }

    public static PointCloud empty(String crs)
    {
        return new PointCloud(new double[0], new double[0], new double[0], PointAttributeSet.empty(0), crs);
    }

    public int size() { return x.length; }
    public boolean isEmpty() { return x.length == 0; }
    public PointAttributeSet getAttributes() { return attributes; }
    public String getCrs() { return crs; }

    public double getX(int i) { return x[i]; }
    public double getY(int i) { return y[i]; }
    public double getZ(int i) { return z[i]; }

    public GeoPoint getPoint(int i)
    {
        return new GeoPoint(x[i], y[i], z[i]);
    }

    /**
     * @return {minX, minY, minZ, maxX, maxY, maxZ}; all zero for an empty cloud
     */
    public double[] bounds()
    {
        if (isEmpty()) return new double[6];
        double[] b = { x[0], y[0], z[0], x[0], y[0], z[0] };
        for (int i = 1; i < x.length; i++) {
            b[0] = Math.min(b[0], x[i]);
            b[1] = Math.min(b[1], y[i]);
            b[2] = Math.min(b[2], z[i]);
            b[3] = Math.max(b[3], x[i]);
            b[4] = Math.max(b[4], y[i]);
            b[5] = Math.max(b[5], z[i]);
        }
        return b;
    }
}
