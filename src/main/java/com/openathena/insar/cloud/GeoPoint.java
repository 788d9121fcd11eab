// GeoPoint.java

package com.openathena.insar.cloud;

/** Ground coordinate triple; z is the deformation value at (x, y). */
public final class GeoPoint
{
    private final double x, y, z;

    public GeoPoint(double x, double y, double z)
    {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getZ() { return z; }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof GeoPoint)) return false;
        GeoPoint p = (GeoPoint) o;
        return Double.compare(x, p.x) == 0 && Double.compare(y, p.y) == 0 && Double.compare(z, p.z) == 0;
    }

    @Override
    public int hashCode()
    {
        int h = Double.hashCode(x);
        h = 31 * h + Double.hashCode(y);
        return 31 * h + Double.hashCode(z);
    }

    @Override
    public String toString()
    {
        return "(" + x + ", " + y + ", " + z + ")";
    }
}
