// AsciiGridRasterReader.java
// ESRI ASCII grid (.asc) reader; CRS comes from a sibling .prj when present

package com.openathena.insar.raster;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

final class AsciiGridRasterReader
{
    private AsciiGridRasterReader() { }

    static RasterGrid read(Path path) throws RasterReadException
    {
        Map<String, String> header = new HashMap<>();
        double[] values;
        int nrows, ncols;

        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.US_ASCII)) {
            String line;
            String firstDataLine = null;
            while ((line = br.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) continue;
                char c = trimmed.charAt(0);
                if (Character.isLetter(c) && !startsWithNumberWord(trimmed)) {
                    String[] kv = trimmed.split("\\s+");
                    if (kv.length != 2) {
                        throw new RasterReadException("Malformed ASCII grid header line '" + trimmed + "'", path);
                    }
                    header.put(kv[0].toLowerCase(Locale.ROOT), kv[1]);
                } else {
                    firstDataLine = trimmed;
                    break;
                }
            }

            ncols = headerInt(header, "ncols", path);
            nrows = headerInt(header, "nrows", path);
            if (ncols <= 0 || nrows <= 0) {
                throw new RasterReadException("ASCII grid has an empty grid (" + nrows + "x" + ncols + ")", path);
            }

            values = new double[nrows * ncols];
            int n = 0;
            line = firstDataLine;
            while (line != null) {
                for (String tok : line.trim().split("\\s+")) {
                    if (tok.isEmpty()) continue;
                    if (n >= values.length) {
                        throw new RasterReadException("ASCII grid has more values than " + nrows + "x" + ncols, path);
                    }
                    values[n++] = RasterValues.parse(tok);
                }
                line = br.readLine();
            }
            if (n != values.length) {
                throw new RasterReadException("ASCII grid has " + n + " values, expected " + values.length, path);
            }
        } catch (NumberFormatException e) {
            throw new RasterReadException("Malformed ASCII grid value (" + e.getMessage() + ")", path, e);
        } catch (IOException e) {
            throw new RasterReadException("Unable to read ASCII grid", path, e);
        }

        double cellsize = headerDouble(header, "cellsize", path);
        double xll, yll;
        if (header.containsKey("xllcorner")) {
            xll = headerDouble(header, "xllcorner", path);
        } else {
            xll = headerDouble(header, "xllcenter", path) - cellsize / 2.0;
        }
        if (header.containsKey("yllcorner")) {
            yll = headerDouble(header, "yllcorner", path);
        } else {
            yll = headerDouble(header, "yllcenter", path) - cellsize / 2.0;
        }

        // first data row is the northern edge
        GeoTransform transform = GeoTransform.northUp(xll, yll + nrows * cellsize, cellsize, -cellsize);
        Double noData = header.containsKey("nodata_value") ? headerDouble(header, "nodata_value", path) : null;

        return new RasterGrid(nrows, ncols, values, transform, readPrj(path), noData);
    }

    // "nan", "inf" and friends are data, not header keys
    private static boolean startsWithNumberWord(String s)
    {
        String lower = s.toLowerCase(Locale.ROOT);
        return lower.startsWith("nan") || lower.startsWith("inf") || lower.startsWith("1.#");
    }

    private static int headerInt(Map<String, String> header, String key, Path path) throws RasterReadException
    {
        String v = header.get(key);
        if (v == null) throw new RasterReadException("ASCII grid header is missing '" + key + "'", path);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new RasterReadException("ASCII grid header '" + key + "' is not an integer", path, e);
        }
    }

    private static double headerDouble(Map<String, String> header, String key, Path path) throws RasterReadException
    {
        String v = header.get(key);
        if (v == null) throw new RasterReadException("ASCII grid header is missing '" + key + "'", path);
        try {
            return RasterValues.parse(v);
        } catch (NumberFormatException e) {
            throw new RasterReadException("ASCII grid header '" + key + "' is not a number", path, e);
        }
    }

    private static String readPrj(Path path) throws RasterReadException
    {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        Path prj = path.resolveSibling((dot > 0 ? name.substring(0, dot) : name) + ".prj");
        if (!Files.isRegularFile(prj)) return "";
        try {
            return Files.readString(prj, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new RasterReadException("Unable to read projection file", prj, e);
        }
    }
}
