// RasterGrid.java

package com.openathena.insar.raster;

import java.util.Arrays;

/**
 * Single band raster held in memory: row-major cell values, the geocoding
 * transform and a coordinate reference identifier.  Immutable once built.
 */
public final class RasterGrid
{
    private final int height, width;
    private final double[] values; // row-major, height * width
    private final GeoTransform transform;
    private final String crs;      // e.g. "EPSG:32650", "" when unknown
    private final Double noData;   // null when the source declares none

    public RasterGrid(int height, int width, double[] values, GeoTransform transform, String crs, Double noData)
    {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Raster must have at least one cell, got " + height + "x" + width);
        }
        if (values.length != (long) height * width) {
            throw new IllegalArgumentException("Expected " + ((long) height * width) + " values, got " + values.length);
        }
        this.height = height;
        this.width = width;
        this.values = Arrays.copyOf(values, values.length);
        this.transform = transform;
        this.crs = (crs == null) ? "" : crs;
        this.noData = noData;
    }

    public int getHeight() { return height; }
    public int getWidth() { return width; }
    public GeoTransform getTransform() { return transform; }
    public String getCrs() { return crs; }
    public Double getNoData() { return noData; }

    public double get(int row, int col)
    {
        if (row < 0 || row >= height || col < 0 || col >= width) {
            throw new IndexOutOfBoundsException("Cell (" + row + "," + col + ") outside " + height + "x" + width);
        }
        return values[row * width + col];
    }

    /** True for NaN or infinite cells and cells holding the declared no-data value. */
    public boolean isMissing(int row, int col)
    {
        double v = get(row, col);
        if (!Double.isFinite(v)) return true;
        return noData != null && v == noData.doubleValue();
    }

    public boolean sameShape(RasterGrid other)
    {
        return other.height == height && other.width == width;
    }

    public String shape()
    {
        return height + "x" + width;
    }
}
