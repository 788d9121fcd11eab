// GeoTransform.java
// six parameter affine geocoding transform, GDAL coefficient order

package com.openathena.insar.raster;

import java.util.Arrays;

/**
 * Affine mapping from grid indices to ground coordinates:
 * <pre>
 *   x = originX + col * pixelWidth + row * rotX
 *   y = originY + col * rotY       + row * pixelHeight
 * </pre>
 * Coefficients are stored in GDAL order
 * {@code [originX, pixelWidth, rotX, originY, rotY, pixelHeight]}.
 * The transform is corner based: (0,0) maps to the outer corner of the
 * first cell.
 */
public final class GeoTransform
{
    // GDAL's default for rasters without georeferencing
    public static final GeoTransform IDENTITY = new GeoTransform(0.0, 1.0, 0.0, 0.0, 0.0, 1.0);

    private final double originX, pixelWidth, rotX;
    private final double originY, rotY, pixelHeight;

    public GeoTransform(double originX, double pixelWidth, double rotX,
                        double originY, double rotY, double pixelHeight)
    {
        this.originX = originX;
        this.pixelWidth = pixelWidth;
        this.rotX = rotX;
        this.originY = originY;
        this.rotY = rotY;
        this.pixelHeight = pixelHeight;
    }

    /** Builds a transform from the six GDAL-ordered coefficients. */
    public static GeoTransform fromGdal(double[] gt)
    {
        if (gt == null || gt.length != 6) {
            throw new IllegalArgumentException("GeoTransform needs exactly 6 coefficients");
        }
        return new GeoTransform(gt[0], gt[1], gt[2], gt[3], gt[4], gt[5]);
    }

    /** North-up transform with no rotation terms. */
    public static GeoTransform northUp(double originX, double originY, double pixelWidth, double pixelHeight)
    {
        return new GeoTransform(originX, pixelWidth, 0.0, originY, 0.0, pixelHeight);
    }

    public double getOriginX() { return originX; }
    public double getPixelWidth() { return pixelWidth; }
    public double getRotX() { return rotX; }
    public double getOriginY() { return originY; }
    public double getRotY() { return rotY; }
    public double getPixelHeight() { return pixelHeight; }

    public boolean isNorthUp() { return rotX == 0.0 && rotY == 0.0; }

    public double[] toGdal()
    {
        return new double[] { originX, pixelWidth, rotX, originY, rotY, pixelHeight };
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof GeoTransform)) return false;
        return Arrays.equals(toGdal(), ((GeoTransform) o).toGdal());
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(toGdal());
    }

    @Override
    public String toString()
    {
        return "GeoTransform" + Arrays.toString(toGdal());
    }
}
