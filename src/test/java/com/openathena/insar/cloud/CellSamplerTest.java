package com.openathena.insar.cloud;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.openathena.insar.RasterFixtures;
import com.openathena.insar.raster.GeoTransform;
import com.openathena.insar.raster.RasterGrid;

import static org.junit.jupiter.api.Assertions.*;

class CellSamplerTest
{
    private static RasterGrid grid(int height, int width, double[] values)
    {
        return new RasterGrid(height, width, values, GeoTransform.northUp(0.0, height, 1.0, -1.0), "", null);
    }

    @ParameterizedTest
    @CsvSource({ "4,4,2,4", "5,5,2,9", "7,3,3,3", "1,1,5,1", "10,10,1,100", "11,4,5,3" })
    void testStrideKeepsCeilRowsTimesCeilCols(int height, int width, int stride, int expected)
    {
        List<GridCell> cells = assertDoesNotThrow(() ->
            CellSampler.select(grid(height, width, RasterFixtures.sequence(height, width)), null, stride, 0.3));

        assertEquals(expected, cells.size());
        assertEquals(expected, CellSampler.decimatedCount(height, width, stride));
        for (GridCell c : cells) {
            assertEquals(0, c.getRow() % stride);
            assertEquals(0, c.getCol() % stride);
        }
    }

    @Test
    void testFourByFourStrideTwo() throws Exception
    {
        List<GridCell> cells = CellSampler.select(grid(4, 4, RasterFixtures.sequence(4, 4)), null, 2, 0.3);

        assertEquals(List.of(new GridCell(0, 0), new GridCell(0, 2), new GridCell(2, 0), new GridCell(2, 2)), cells);
    }

    @Test
    void testCoherenceThresholdIsInclusive() throws Exception
    {
        RasterGrid def = grid(1, 4, new double[] { 1.0, 2.0, 3.0, 4.0 });
        RasterGrid coh = grid(1, 4, new double[] { 0.29, 0.3, 0.31, 1.0 });

        List<GridCell> cells = CellSampler.select(def, coh, 1, 0.3);

        assertEquals(List.of(new GridCell(0, 1), new GridCell(0, 2), new GridCell(0, 3)), cells);
    }

    @Test
    void testEveryKeptCellMeetsThreshold() throws Exception
    {
        int h = 6, w = 6;
        double[] cohValues = new double[h * w];
        for (int i = 0; i < cohValues.length; i++) cohValues[i] = (i % 10) / 10.0;
        RasterGrid def = grid(h, w, RasterFixtures.sequence(h, w));
        RasterGrid coh = grid(h, w, cohValues);

        List<GridCell> cells = CellSampler.select(def, coh, 2, 0.5);

        assertFalse(cells.isEmpty());
        for (GridCell c : cells) {
            assertTrue(coh.get(c.getRow(), c.getCol()) >= 0.5, "kept " + c);
        }
    }

    @Test
    void testLowCoherenceEverywhereKeepsNothing() throws Exception
    {
        RasterGrid def = grid(4, 4, RasterFixtures.sequence(4, 4));
        RasterGrid coh = grid(4, 4, RasterFixtures.filled(4, 4, 0.2));

        assertTrue(CellSampler.select(def, coh, 2, 0.3).isEmpty());
    }

    @Test
    void testMissingValuesAreSkipped() throws Exception
    {
        double[] defValues = RasterFixtures.sequence(2, 2);
        defValues[0] = Double.NaN;
        defValues[1] = -9999.0;
        RasterGrid def = new RasterGrid(2, 2, defValues, GeoTransform.IDENTITY, "", -9999.0);
        RasterGrid coh = grid(2, 2, new double[] { 1.0, 1.0, Double.NaN, 0.9 });

        List<GridCell> cells = CellSampler.select(def, coh, 1, 0.3);

        assertEquals(List.of(new GridCell(1, 1)), cells);
    }

    @Test
    void testShapeMismatchIsRejected()
    {
        RasterGrid def = grid(4, 4, RasterFixtures.sequence(4, 4));
        RasterGrid coh = grid(3, 4, RasterFixtures.filled(3, 4, 1.0));

        DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
                                                     () -> CellSampler.select(def, coh, 2, 0.3));
        assertTrue(e.getMessage().contains("4x4"));
        assertTrue(e.getMessage().contains("3x4"));
    }

    @Test
    void testInvalidParameters()
    {
        RasterGrid def = grid(2, 2, RasterFixtures.sequence(2, 2));

        assertThrows(IllegalArgumentException.class, () -> CellSampler.select(def, null, 0, 0.3));
        assertThrows(IllegalArgumentException.class, () -> CellSampler.select(def, null, 1, 1.5));
        assertThrows(IllegalArgumentException.class, () -> CellSampler.select(def, null, 1, Double.NaN));
    }

    @Test
    void testInfiniteDeformationIsSkipped() throws Exception
    {
        RasterGrid def = grid(1, 4, new double[] { 0.5, Double.POSITIVE_INFINITY, 0.25, Double.NEGATIVE_INFINITY });

        List<GridCell> cells = CellSampler.select(def, null, 1, 0.3);

        assertEquals(List.of(new GridCell(0, 0), new GridCell(0, 2)), cells);
    }

    @Test
    void testInfiniteCoherenceIsSkipped() throws Exception
    {
        RasterGrid def = grid(1, 2, new double[] { 1.0, 2.0 });
        RasterGrid coh = grid(1, 2, new double[] { Double.POSITIVE_INFINITY, 0.9 });

        assertEquals(List.of(new GridCell(0, 1)), CellSampler.select(def, coh, 1, 0.3));
    }
}
