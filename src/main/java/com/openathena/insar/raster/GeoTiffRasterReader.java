// GeoTiffRasterReader.java
// read a single band GeoTIFF into a RasterGrid using the mil.nga tiff library

package com.openathena.insar.raster;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.util.TiffException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class GeoTiffRasterReader
{
    private static final Logger logger = LoggerFactory.getLogger(GeoTiffRasterReader.class);

    // GeoTIFF tag IDs
    static final int TAG_ModelPixelScale     = 33550;
    static final int TAG_ModelTiepoint       = 33922;
    static final int TAG_ModelTransformation = 34264;
    static final int TAG_GeoKeyDirectory     = 34735;
    static final int TAG_GDAL_NODATA         = 42113;

    // GeoKey IDs
    static final int KEY_GTRasterTypeGeoKey     = 1025;
    static final int KEY_GeographicTypeGeoKey   = 2048;
    static final int KEY_ProjectedCSTypeGeoKey  = 3072;
    static final int RASTER_PIXEL_IS_POINT      = 2;

    private GeoTiffRasterReader() { }

    static RasterGrid read(Path path) throws RasterReadException
    {
        FileDirectory dir;
        Rasters rasters;
        try {
            TIFFImage tiff = TiffReader.readTiff(path.toFile());
            dir = tiff.getFileDirectory();
            if (dir == null) {
                throw new RasterReadException("GeoTIFF has no image directory", path);
            }
            rasters = dir.readRasters();
        } catch (IOException | TiffException e) {
            throw new RasterReadException("Unable to decode GeoTIFF: " + e.getMessage(), path, e);
        }

        if (rasters == null) {
            throw new RasterReadException("No raster data found in GeoTIFF", path);
        }
        int width = rasters.getWidth();
        int height = rasters.getHeight();
        if (width <= 0 || height <= 0) {
            throw new RasterReadException("GeoTIFF has an empty grid (" + height + "x" + width + ")", path);
        }
        if (rasters.getSamplesPerPixel() > 1) {
            logger.warn("{} has {} bands; using the first", path.getFileName(), rasters.getSamplesPerPixel());
        }

        double[] values = new double[width * height];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                Number sample = rasters.getFirstPixelSample(col, row);
                values[row * width + col] = (sample == null) ? Double.NaN : sample.doubleValue();
            }
        }

        List<Integer> geoKeys = getTagValues(dir, TAG_GeoKeyDirectory, Integer.class);
        GeoTransform transform = buildTransform(dir, geoKeys);
        if (transform == null) {
            logger.warn("{}: no georeferencing found; operating in pixel space", path.getFileName());
            transform = GeoTransform.IDENTITY;
        }

        String crs = extractHorizontalCrs(geoKeys);
        Double noData = readNoData(dir);

        return new RasterGrid(height, width, values, transform, crs, noData);
    }

    /**
     * Corner based affine (GDAL convention).  Order of preference:
     *   1) ModelTransformation (4x4)
     *   2) ModelPixelScale + ModelTiepoint, north-up
     * PixelIsPoint rasters are shifted half a pixel to the cell corner.
     */
    static GeoTransform buildTransform(FileDirectory d, List<Integer> geoKeys)
    {
        boolean pixelIsPoint = geoKeyValue(geoKeys, KEY_GTRasterTypeGeoKey) == RASTER_PIXEL_IS_POINT;

        List<Double> mt = getTagValues(d, TAG_ModelTransformation, Double.class);
        if (mt != null && mt.size() == 16) {
            double a1 = mt.get(0), a2 = mt.get(1), a0 = mt.get(3);
            double b1 = mt.get(4), b2 = mt.get(5), b0 = mt.get(7);
            if (pixelIsPoint) {
                a0 = a0 - 0.5 * a1 - 0.5 * a2;
                b0 = b0 - 0.5 * b1 - 0.5 * b2;
            }
            return new GeoTransform(a0, a1, a2, b0, b1, b2);
        }

        List<Double> scale = getTagValues(d, TAG_ModelPixelScale, Double.class);
        List<Double> tie = getTagValues(d, TAG_ModelTiepoint, Double.class);
        if (scale != null && scale.size() >= 2 && tie != null && tie.size() >= 6) {
            double sx = scale.get(0), sy = scale.get(1);
            double i = tie.get(0), j = tie.get(1), x = tie.get(3), y = tie.get(4);

            double originX = x - i * sx;
            double originY = y + j * sy;
            if (pixelIsPoint) {
                originX -= 0.5 * sx;
                originY += 0.5 * sy;
            }
            return GeoTransform.northUp(originX, originY, sx, -sy);
        }

        return null;
    }

    // EPSG:4326 is WGS84; projected CRS wins over the geographic one it is based on
    static String extractHorizontalCrs(List<Integer> geoKeys)
    {
        int projected = geoKeyValue(geoKeys, KEY_ProjectedCSTypeGeoKey);
        if (projected > 0) return "EPSG:" + projected;
        int geographic = geoKeyValue(geoKeys, KEY_GeographicTypeGeoKey);
        if (geographic > 0) return "EPSG:" + geographic;
        return "";
    }

    /**
     * Value of an inline (short) GeoKey, or -1 when absent.  The directory
     * starts with the header {1, 1, 0, numKeys} followed by 4-short entries.
     */
    static int geoKeyValue(List<Integer> geoKeys, int keyId)
    {
        if (geoKeys == null || geoKeys.size() < 4) return -1;
        int numKeys = geoKeys.get(3);
        for (int k = 0, idx = 4; k < numKeys && idx + 3 < geoKeys.size(); k++, idx += 4) {
            int tiffTag = geoKeys.get(idx + 1);
            int count = geoKeys.get(idx + 2);
            if (geoKeys.get(idx) == keyId && tiffTag == 0 && count == 1) {
                return geoKeys.get(idx + 3);
            }
        }
        return -1;
    }

    private static Double readNoData(FileDirectory d)
    {
        FileDirectoryEntry entry = findEntry(d, TAG_GDAL_NODATA);
        if (entry == null) return null;
        String s = toAscii(entry.getValues()).replace("\0", "").trim();
        if (s.isEmpty()) return null;
        try {
            return RasterValues.parse(s);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring unparseable GDAL_NODATA value '{}'", s);
            return null;
        }
    }

    /**
     * Extracts tag values from the FileDirectory as a List.  Pass in the
     * expected element type so mismatched entries are skipped rather than cast.
     */
    static <T> List<T> getTagValues(FileDirectory directory, int tag, Class<T> type)
    {
        FileDirectoryEntry entry = findEntry(directory, tag);
        if (entry == null) return null;

        Object values = entry.getValues();
        if (!(values instanceof List<?>)) return null;

        List<T> castedValues = new ArrayList<>();
        for (Object item : (List<?>) values) {
            if (type.isInstance(item)) {
                castedValues.add(type.cast(item));
            }
            else if (item instanceof Number && type == Double.class) {
                castedValues.add(type.cast(((Number) item).doubleValue()));
            }
            else if (item instanceof Number && type == Integer.class) {
                castedValues.add(type.cast(((Number) item).intValue()));
            }
        }
        return castedValues;
    }

    private static FileDirectoryEntry findEntry(FileDirectory d, int tag)
    {
        FieldTagType fieldTag = FieldTagType.getById(tag);
        if (fieldTag == null) return null;
        for (FileDirectoryEntry entry : safeEntries(d)) {
            if (entry.getFieldTag() == fieldTag) return entry;
        }
        return null;
    }

    private static Set<FileDirectoryEntry> safeEntries(FileDirectory d)
    {
        Set<FileDirectoryEntry> s = d.getEntries();
        return (s == null) ? Collections.emptySet() : s;
    }

    private static String toAscii(Object v)
    {
        if (v == null) return "";
        if (v instanceof String) return (String) v;
        if (v instanceof byte[]) return new String((byte[]) v, StandardCharsets.US_ASCII);
        if (v instanceof List<?>) {
            StringBuilder sb = new StringBuilder();
            for (Object o : (List<?>) v) sb.append(o);
            return sb.toString();
        }
        return String.valueOf(v);
    }
}
