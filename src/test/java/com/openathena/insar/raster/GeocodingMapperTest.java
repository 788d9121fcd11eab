package com.openathena.insar.raster;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class GeocodingMapperTest
{
    private static final double EPS = 1e-9;

    @ParameterizedTest
    @CsvSource({ "0,0", "0,7", "3,0", "5,11", "120,33" })
    void testAffineLawWithRotation(int row, int col)
    {
        GeoTransform t = new GeoTransform(500000.0, 30.0, 0.5, 4200000.0, -0.25, -30.0);
        double[] g = GeocodingMapper.cellToGround(row, col, t);

        assertEquals(500000.0 + col * 30.0 + row * 0.5, g[0], EPS);
        assertEquals(4200000.0 + col * -0.25 + row * -30.0, g[1], EPS);
    }

    @Test
    void testNorthUpOriginIsCellZeroCorner()
    {
        GeoTransform t = GeoTransform.northUp(10.0, 20.0, 2.0, -2.0);

        assertArrayEquals(new double[] { 10.0, 20.0 }, GeocodingMapper.cellToGround(0, 0, t), EPS);
        assertArrayEquals(new double[] { 16.0, 14.0 }, GeocodingMapper.cellToGround(3, 3, t), EPS);
    }

    @Test
    void testIdentityMapsColumnToXAndRowToY()
    {
        double[] g = GeocodingMapper.cellToGround(2, 5, GeoTransform.IDENTITY);

        assertEquals(5.0, g[0], EPS);
        assertEquals(2.0, g[1], EPS);
    }

    @Test
    void testGridBoundsCoversCornerCells()
    {
        GeoTransform t = GeoTransform.northUp(0.0, 4.0, 1.0, -1.0);
        double[] b = GeocodingMapper.gridBounds(4, 3, t);

        // cells (0,0) .. (3,2)
        assertArrayEquals(new double[] { 0.0, 1.0, 2.0, 4.0 }, b, EPS);
    }

    @Test
    void testGdalRoundTrip()
    {
        double[] gt = { 1.0, 2.0, 3.0, 4.0, 5.0, 6.0 };
        GeoTransform t = GeoTransform.fromGdal(gt);

        assertEquals(1.0, t.getOriginX());
        assertEquals(2.0, t.getPixelWidth());
        assertEquals(3.0, t.getRotX());
        assertEquals(4.0, t.getOriginY());
        assertEquals(5.0, t.getRotY());
        assertEquals(6.0, t.getPixelHeight());
        assertArrayEquals(gt, t.toGdal());
        assertFalse(t.isNorthUp());
        assertEquals(t, GeoTransform.fromGdal(gt));
    }
}
