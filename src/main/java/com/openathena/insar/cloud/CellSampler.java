// CellSampler.java
// spatial decimation plus validity filtering of raster cells

package com.openathena.insar.cloud;

import java.util.ArrayList;
import java.util.List;

import com.openathena.insar.raster.RasterGrid;

/**
 * Picks the cells that become points.  A cell survives when it lies on the
 * decimation grid ({@code row % stride == 0 && col % stride == 0}), its
 * deformation value is present, and its coherence is at least the threshold.
 * Without a coherence raster every cell counts as fully coherent.
 */
public final class CellSampler
{
    public static final double DEFAULT_COHERENCE_THRESHOLD = 0.3;

    private CellSampler() { }

    /**
     * @param deformation the deformation grid
     * @param coherence coherence grid of identical shape, or null
     * @param stride decimation stride, at least 1
     * @param threshold minimum coherence kept, in [0,1]
     * @return surviving cells in row-major order; empty when nothing survives
     * @throws DimensionMismatchException if the coherence grid has another shape
     */
    public static List<GridCell> select(RasterGrid deformation, RasterGrid coherence, int stride, double threshold)
        throws DimensionMismatchException
    {
        if (stride < 1) {
            throw new IllegalArgumentException("Decimation stride must be at least 1, got " + stride);
        }
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("Coherence threshold must be within [0,1], got " + threshold);
        }
        if (coherence != null && !deformation.sameShape(coherence)) {
            throw new DimensionMismatchException(deformation.shape(), coherence.shape(), null);
        }

        List<GridCell> cells = new ArrayList<>();
        for (int row = 0; row < deformation.getHeight(); row += stride) {
            for (int col = 0; col < deformation.getWidth(); col += stride) {
                if (deformation.isMissing(row, col)) continue; // NaN, infinite or no-data
                if (coherence != null) {
                    // NaN or no-data coherence never passes
                    if (coherence.isMissing(row, col) || coherence.get(row, col) < threshold) continue;
                }
                cells.add(new GridCell(row, col));
            }
        }
        return cells;
    }

    /** Number of cells on the decimation grid before any filtering. */
    public static long decimatedCount(int height, int width, int stride)
    {
        long rows = (height + stride - 1) / stride;
        long cols = (width + stride - 1) / stride;
        return rows * cols;
    }
}
