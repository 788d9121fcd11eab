// ConversionConfigLoader.java
// reads the processing parameters YAML file

package com.openathena.insar.convert;

import java.io.IOException;
import java.io.Reader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a {@link ConversionConfig} from a processing parameters file laid
 * out as:
 * <pre>
 * paths:
 *   results: ../data/results
 * point_cloud:
 *   conversion:
 *     resolution: 5
 *     coherence_threshold: 0.3
 *     raster_extensions: [tif, tiff, asc]
 *     threads: 1
 * </pre>
 * Missing keys keep their defaults; other sections of the file are ignored.
 * Relative paths are resolved against the directory holding the file.
 */
public final class ConversionConfigLoader
{
    private static final Logger logger = LoggerFactory.getLogger(ConversionConfigLoader.class);

    private ConversionConfigLoader() { }

    public static ConversionConfig load(Path configFile) throws IOException
    {
        logger.info("Reading processing parameters from: {}", configFile.toAbsolutePath());

        Map<String, Object> yamlData;
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            yamlData = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new IOException("Malformed YAML in " + configFile + ": " + e.getMessage(), e);
        } catch (ClassCastException e) {
            throw new IOException("Top level of " + configFile + " is not a mapping", e);
        }

        ConversionConfig config = new ConversionConfig();
        if (yamlData == null) {
            logger.warn("YAML file is empty: {}", configFile.toAbsolutePath());
            return config;
        }

        Path base = configFile.toAbsolutePath().getParent();

        Map<String, Object> paths = getMap(yamlData, "paths");
        String results = getString(paths, "results");
        if (results != null) config.setResultsDir(base.resolve(results).normalize());

        Map<String, Object> conversion = getMap(getMap(yamlData, "point_cloud"), "conversion");
        Integer resolution = getInteger(conversion, "resolution");
        if (resolution != null) config.setStride(resolution);
        Number threshold = getNumber(conversion, "coherence_threshold");
        if (threshold != null) config.setCoherenceThreshold(threshold.doubleValue());
        Integer threads = getInteger(conversion, "threads");
        if (threads != null) config.setThreads(threads);
        List<String> extensions = getStringList(conversion, "raster_extensions");
        if (extensions != null) config.setRasterExtensions(extensions);

        return config;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> parent, String key)
    {
        if (parent == null) return null;
        Object v = parent.get(key);
        return (v instanceof Map) ? (Map<String, Object>) v : null;
    }

    private static String getString(Map<String, Object> parent, String key)
    {
        if (parent == null) return null;
        Object v = parent.get(key);
        return (v == null) ? null : v.toString();
    }

    private static Number getNumber(Map<String, Object> parent, String key)
    {
        if (parent == null) return null;
        Object v = parent.get(key);
        if (v == null) return null;
        if (v instanceof Number) return (Number) v;
        throw new IllegalArgumentException("'" + key + "' must be a number, got '" + v + "'");
    }

    // YAML integers load as Integer, Long or BigInteger; 2.5 or 1e3 are rejected, never truncated
    private static Integer getInteger(Map<String, Object> parent, String key)
    {
        Number n = getNumber(parent, key);
        if (n == null) return null;
        boolean integral = n instanceof Integer || n instanceof Long || n instanceof BigInteger;
        if (!integral || n.longValue() != n.intValue()) {
            throw new IllegalArgumentException("'" + key + "' must be an integer, got '" + n + "'");
        }
        return n.intValue();
    }

    private static List<String> getStringList(Map<String, Object> parent, String key)
    {
        if (parent == null) return null;
        Object v = parent.get(key);
        if (v == null) return null;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?>) {
            for (Object o : (List<?>) v) out.add(String.valueOf(o));
        } else {
            out.add(v.toString());
        }
        return out;
    }
}
