// PointCloudBuilder.java

package com.openathena.insar.cloud;

import java.util.List;

import com.openathena.insar.raster.GeoTransform;
import com.openathena.insar.raster.GeocodingMapper;
import com.openathena.insar.raster.RasterGrid;

/**
 * Turns selected cells into a point cloud: geocoded (x, y), z = deformation,
 * and the attributes {@code deformation} and {@code coherence}.  Coherence is
 * 1.0 for every point when no coherence grid is supplied.
 */
public final class PointCloudBuilder
{
    private PointCloudBuilder() { }

    public static PointCloud build(RasterGrid deformation, RasterGrid coherence, List<GridCell> cells)
        throws DimensionMismatchException
    {
        if (coherence != null && !deformation.sameShape(coherence)) {
            throw new DimensionMismatchException(deformation.shape(), coherence.shape(), null);
        }

        GeoTransform transform = deformation.getTransform();
        int n = cells.size();
        double[] x = new double[n];
        double[] y = new double[n];
        double[] z = new double[n];
        double[] coh = new double[n];

        for (int i = 0; i < n; i++) {
            GridCell cell = cells.get(i);
            double[] ground = GeocodingMapper.cellToGround(cell.getRow(), cell.getCol(), transform);
            x[i] = ground[0];
            y[i] = ground[1];
            z[i] = deformation.get(cell.getRow(), cell.getCol());
            coh[i] = (coherence != null) ? coherence.get(cell.getRow(), cell.getCol()) : 1.0;
        }

        PointAttributeSet attributes = PointAttributeSet.builder(n)
            .put(PointAttributeSet.DEFORMATION, z)
            .put(PointAttributeSet.COHERENCE, coh)
            .build();

        return new PointCloud(x, y, z, attributes, deformation.getCrs());
    }
}
