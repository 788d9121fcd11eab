// RasterFormat.java

package com.openathena.insar.raster;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Raster encodings the reader understands, recognized by their leading bytes
 * rather than by file extension.
 */
public enum RasterFormat
{
    GEOTIFF("GeoTIFF"),
    ESRI_ASCII_GRID("ESRI ASCII grid"),
    UNKNOWN("Other/unknown");

    private final String description;

    RasterFormat(String description) {
        this.description = description;
    }

    public String getDescription() { return description; }

    public static RasterFormat detect(Path p) throws IOException
    {
        try (RandomAccessFile in = new RandomAccessFile(p.toFile(), "r")) {
            byte[] hdr = new byte[(int) Math.min(16, in.length())];
            in.readFully(hdr);
            if (hdr.length >= 4) {
                // classic TIFF only; BigTIFF (43) is not handled by the tiff reader
                boolean little = hdr[0] == 'I' && hdr[1] == 'I' && hdr[2] == 42 && hdr[3] == 0;
                boolean big = hdr[0] == 'M' && hdr[1] == 'M' && hdr[2] == 0 && hdr[3] == 42;
                if (little || big) return GEOTIFF;
            }
            String head = new String(hdr, StandardCharsets.US_ASCII).trim().toLowerCase(Locale.ROOT);
            if (head.startsWith("ncols")) return ESRI_ASCII_GRID;
            return UNKNOWN;
        }
    }
}
