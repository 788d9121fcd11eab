// DeformationConverter.java

package com.openathena.insar.convert;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.openathena.insar.ConversionException;
import com.openathena.insar.cloud.CellSampler;
import com.openathena.insar.cloud.DimensionMismatchException;
import com.openathena.insar.cloud.GridCell;
import com.openathena.insar.cloud.PointCloud;
import com.openathena.insar.cloud.PointCloudBuilder;
import com.openathena.insar.io.PointCloudWriter;
import com.openathena.insar.raster.RasterGrid;
import com.openathena.insar.raster.RasterReader;

/**
 * Converts one deformation/coherence pair: read, sample, build, then hand the
 * cloud to every writer.  Holds no state between pairs.
 */
public class DeformationConverter
{
    private static final Logger logger = LoggerFactory.getLogger(DeformationConverter.class);

    private final int stride;
    private final double coherenceThreshold;
    private final List<PointCloudWriter> writers;

    public DeformationConverter(int stride, double coherenceThreshold, List<PointCloudWriter> writers)
    {
        if (writers.isEmpty()) throw new IllegalArgumentException("At least one point cloud writer is required");
        this.stride = stride;
        this.coherenceThreshold = coherenceThreshold;
        this.writers = List.copyOf(writers);
    }

    /** Builds the point cloud for a pair without writing it. */
    public PointCloud buildCloud(RasterPair pair) throws ConversionException
    {
        RasterGrid deformation = RasterReader.read(pair.getDeformation());
        RasterGrid coherence = null;
        if (pair.hasCoherence()) {
            coherence = RasterReader.read(pair.getCoherence());
        } else {
            logger.warn("No coherence raster for {}; keeping every valid cell with coherence 1.0",
                        pair.getDeformation().getFileName());
        }

        // checked here as well so the error names the coherence file
        if (coherence != null && !deformation.sameShape(coherence)) {
            throw new DimensionMismatchException(deformation.shape(), coherence.shape(), pair.getCoherence());
        }
        List<GridCell> cells = CellSampler.select(deformation, coherence, stride, coherenceThreshold);
        logger.debug("{}: {} of {} decimated cells kept (stride {}, threshold {})", pair.getDateStamp(), cells.size(),
                     CellSampler.decimatedCount(deformation.getHeight(), deformation.getWidth(), stride),
                     stride, coherenceThreshold);

        return PointCloudBuilder.build(deformation, coherence, cells);
    }

    /**
     * Converts the pair and writes one file per writer into {@code outputDir}.
     *
     * @return number of points written
     */
    public int convert(RasterPair pair, Path outputDir) throws ConversionException
    {
        PointCloud cloud = buildCloud(pair);
        for (PointCloudWriter writer : writers) {
            Path target = outputDir.resolve(pair.outputStem() + "." + writer.extension());
            writer.write(cloud, target);
        }
        logger.info("Converted {} -> {} points", pair, cloud.size());
        return cloud.size();
    }
}
