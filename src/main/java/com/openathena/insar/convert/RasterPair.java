// RasterPair.java

package com.openathena.insar.convert;

import java.nio.file.Path;

/**
 * A deformation raster and, when one exists, the coherence raster sharing its
 * date stamp.
 */
public final class RasterPair
{
    private final String dateStamp;
    private final Path deformation;
    private final Path coherence; // null when absent

    public RasterPair(String dateStamp, Path deformation, Path coherence)
    {
        this.dateStamp = dateStamp;
        this.deformation = deformation;
        this.coherence = coherence;
    }

    public String getDateStamp() { return dateStamp; }
    public Path getDeformation() { return deformation; }
    public Path getCoherence() { return coherence; }
    public boolean hasCoherence() { return coherence != null; }

    /** Output base name, e.g. "20210101_20210113_unwrap". */
    public String outputStem()
    {
        return dateStamp + RasterPairScanner.DEFORMATION_SUFFIX;
    }

    @Override
    public String toString()
    {
        return deformation.getFileName() + (coherence != null ? " + " + coherence.getFileName() : " (no coherence)");
    }
}
