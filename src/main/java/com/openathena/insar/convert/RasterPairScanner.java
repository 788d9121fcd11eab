// RasterPairScanner.java

package com.openathena.insar.convert;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds {@code <datestamp>_unwrap.<ext>} deformation rasters in a directory
 * and pairs each with {@code <datestamp>_corr.<ext>} when that file exists.
 */
public final class RasterPairScanner
{
    private static final Logger logger = LoggerFactory.getLogger(RasterPairScanner.class);

    public static final String DEFORMATION_SUFFIX = "_unwrap";
    public static final String COHERENCE_SUFFIX = "_corr";

    private RasterPairScanner() { }

    /**
     * @return pairs sorted by deformation file name
     * @throws IOException if the directory is missing or cannot be listed
     */
    public static List<RasterPair> scan(Path inputDir, List<String> extensions) throws IOException
    {
        if (!Files.exists(inputDir)) throw new NoSuchFileException(inputDir.toString(), null, "input directory not found");
        if (!Files.isDirectory(inputDir)) throw new NotDirectoryException(inputDir.toString());

        List<RasterPair> pairs = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(inputDir)) {
            for (Path file : entries) {
                if (!Files.isRegularFile(file)) continue;
                RasterPair pair = match(file, extensions);
                if (pair != null) pairs.add(pair);
            }
        }
        pairs.sort(Comparator.comparing(p -> p.getDeformation().getFileName().toString()));
        logger.debug("Found {} deformation rasters in {}", pairs.size(), inputDir);
        return pairs;
    }

    /** Pair for a deformation file name, or null when the name does not follow the convention. */
    static RasterPair match(Path file, List<String> extensions)
    {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0) return null;
        String ext = name.substring(dot + 1);
        if (!extensions.contains(ext.toLowerCase(Locale.ROOT))) return null;

        String stem = name.substring(0, dot);
        if (!stem.endsWith(DEFORMATION_SUFFIX) || stem.length() == DEFORMATION_SUFFIX.length()) return null;

        String dateStamp = stem.substring(0, stem.length() - DEFORMATION_SUFFIX.length());
        Path coherence = file.resolveSibling(dateStamp + COHERENCE_SUFFIX + "." + ext);
        return new RasterPair(dateStamp, file, Files.isRegularFile(coherence) ? coherence : null);
    }
}
