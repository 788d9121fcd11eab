// RasterReader.java

package com.openathena.insar.raster;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for loading a single band geo-referenced raster.  Dispatches on
 * the detected file format.
 */
public final class RasterReader
{
    private static final Logger logger = LoggerFactory.getLogger(RasterReader.class);

    private RasterReader() { }

    public static RasterGrid read(Path path) throws RasterReadException
    {
        if (!Files.isRegularFile(path)) {
            throw new RasterReadException("Raster file not found", path);
        }

        RasterFormat format;
        try {
            format = RasterFormat.detect(path);
        } catch (IOException e) {
            throw new RasterReadException("Unable to read raster header", path, e);
        }

        RasterGrid grid;
        switch (format) {
        case GEOTIFF:
            grid = GeoTiffRasterReader.read(path);
            break;
        case ESRI_ASCII_GRID:
            grid = AsciiGridRasterReader.read(path);
            break;
        default:
            throw new RasterReadException("Unsupported raster format", path);
        }

        logger.debug("Read {} {} ({}) CRS '{}' {}", format.getDescription(), path.getFileName(),
                     grid.shape(), grid.getCrs(), grid.getTransform());
        return grid;
    }
}
