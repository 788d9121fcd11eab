// ConversionConfig.java

package com.openathena.insar.convert;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import com.openathena.insar.cloud.CellSampler;

/**
 * Processing parameters for one orchestrator run.  Values are validated when
 * set; unset directories default to {@code <results>/deformation} and
 * {@code <results>/point_cloud}.
 */
public final class ConversionConfig
{
    public static final int DEFAULT_STRIDE = 5;
    public static final Path DEFAULT_RESULTS = Path.of("data", "results");
    public static final List<String> DEFAULT_EXTENSIONS = Collections.unmodifiableList(Arrays.asList("tif", "tiff", "asc"));

    private Path resultsDir = DEFAULT_RESULTS;
    private Path inputDir;
    private Path outputDir;
    private int stride = DEFAULT_STRIDE;
    private double coherenceThreshold = CellSampler.DEFAULT_COHERENCE_THRESHOLD;
    private List<String> rasterExtensions = DEFAULT_EXTENSIONS;
    private int threads = 1;

    public Path getResultsDir() { return resultsDir; }

    public ConversionConfig setResultsDir(Path resultsDir)
    {
        this.resultsDir = resultsDir;
        return this;
    }

    public Path getInputDir()
    {
        return (inputDir != null) ? inputDir : resultsDir.resolve("deformation");
    }

    public ConversionConfig setInputDir(Path inputDir)
    {
        this.inputDir = inputDir;
        return this;
    }

    public Path getOutputDir()
    {
        return (outputDir != null) ? outputDir : resultsDir.resolve("point_cloud");
    }

    public ConversionConfig setOutputDir(Path outputDir)
    {
        this.outputDir = outputDir;
        return this;
    }

    public int getStride() { return stride; }

    public ConversionConfig setStride(int stride)
    {
        if (stride < 1) throw new IllegalArgumentException("Decimation stride must be a positive integer, got " + stride);
        this.stride = stride;
        return this;
    }

    public double getCoherenceThreshold() { return coherenceThreshold; }

    public ConversionConfig setCoherenceThreshold(double threshold)
    {
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("Coherence threshold must be within [0,1], got " + threshold);
        }
        this.coherenceThreshold = threshold;
        return this;
    }

    public List<String> getRasterExtensions() { return rasterExtensions; }

    public ConversionConfig setRasterExtensions(List<String> extensions)
    {
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException("At least one raster extension is required");
        }
        List<String> cleaned = new ArrayList<>();
        for (String ext : extensions) {
            String e = ext.trim().toLowerCase(Locale.ROOT);
            if (e.startsWith(".")) e = e.substring(1);
            if (e.isEmpty()) throw new IllegalArgumentException("Empty raster extension");
            cleaned.add(e);
        }
        this.rasterExtensions = Collections.unmodifiableList(cleaned);
        return this;
    }

    public int getThreads() { return threads; }

    public ConversionConfig setThreads(int threads)
    {
        if (threads < 1) throw new IllegalArgumentException("Thread count must be at least 1, got " + threads);
        this.threads = threads;
        return this;
    }

    @Override
    public String toString()
    {
        return "input=" + getInputDir() + " output=" + getOutputDir() + " stride=" + stride
            + " threshold=" + coherenceThreshold + " extensions=" + rasterExtensions + " threads=" + threads;
    }
}
