// GeocodingMapper.java

package com.openathena.insar.raster;

/**
 * Maps grid indices to ground coordinates.  Coordinates are evaluated at the
 * cell index itself, not the cell center; no interpolation.
 */
public final class GeocodingMapper
{
    private GeocodingMapper() { }

    /**
     * @return {x, y} for cell (row, col) under the given transform
     */
    public static double[] cellToGround(int row, int col, GeoTransform t)
    {
        double x = t.getOriginX() + col * t.getPixelWidth() + row * t.getRotX();
        double y = t.getOriginY() + col * t.getRotY() + row * t.getPixelHeight();
        return new double[] { x, y };
    }

    /**
     * Ground-space bounding box of the cell grid {minX, minY, maxX, maxY},
     * taken over the four corner cell indices.
     */
    public static double[] gridBounds(int height, int width, GeoTransform t)
    {
        int lastRow = Math.max(height - 1, 0);
        int lastCol = Math.max(width - 1, 0);
        double[][] corners = {
            cellToGround(0, 0, t),
            cellToGround(0, lastCol, t),
            cellToGround(lastRow, 0, t),
            cellToGround(lastRow, lastCol, t)
        };
        double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        for (double[] c : corners) {
            minX = Math.min(minX, c[0]);
            maxX = Math.max(maxX, c[0]);
            minY = Math.min(minY, c[1]);
            maxY = Math.max(maxY, c[1]);
        }
        return new double[] { minX, minY, maxX, maxY };
    }
}
