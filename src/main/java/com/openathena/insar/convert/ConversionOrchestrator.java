// ConversionOrchestrator.java

package com.openathena.insar.convert;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.openathena.insar.ConversionException;
import com.openathena.insar.io.LasPointCloudWriter;
import com.openathena.insar.io.PointCloudWriter;
import com.openathena.insar.io.XyzPointCloudWriter;

/**
 * Converts every deformation raster found in the input directory.  Pairs are
 * independent: a failed pair is logged and counted, the rest still run.
 * Only a missing or unreadable input directory aborts the run.
 */
public class ConversionOrchestrator
{
    private static final Logger logger = LoggerFactory.getLogger(ConversionOrchestrator.class);

    private final ConversionConfig config;
    private final DeformationConverter converter;

    public ConversionOrchestrator(ConversionConfig config)
    {
        this(config, List.of(new LasPointCloudWriter(), new XyzPointCloudWriter()));
    }

    public ConversionOrchestrator(ConversionConfig config, List<PointCloudWriter> writers)
    {
        this.config = config;
        this.converter = new DeformationConverter(config.getStride(), config.getCoherenceThreshold(), writers);
    }

    public ConversionSummary run() throws IOException
    {
        List<RasterPair> pairs = RasterPairScanner.scan(config.getInputDir(), config.getRasterExtensions());
        logger.info("Found {} deformation rasters in {}", pairs.size(), config.getInputDir());

        Path outputDir = config.getOutputDir();
        Files.createDirectories(outputDir);

        Set<String> ambiguous = ambiguousStems(pairs);
        List<Outcome> outcomes = (config.getThreads() > 1 && pairs.size() > 1)
            ? runParallel(pairs, outputDir, ambiguous)
            : runSequential(pairs, outputDir, ambiguous);

        int converted = 0;
        long points = 0;
        List<ConversionSummary.Failure> failures = new ArrayList<>();
        for (Outcome o : outcomes) {
            if (o.failure == null) {
                converted++;
                points += o.points;
            } else {
                failures.add(o.failure);
            }
        }

        ConversionSummary summary = new ConversionSummary(pairs.size(), converted, points, failures);
        logger.info("Conversion finished: {}", summary);
        return summary;
    }

    // output stems shared by more than one deformation raster, e.g. 20200101_unwrap.asc and .tif
    static Set<String> ambiguousStems(List<RasterPair> pairs)
    {
        Map<String, Integer> counts = new HashMap<>();
        for (RasterPair pair : pairs) {
            counts.merge(pair.outputStem(), 1, Integer::sum);
        }
        Set<String> ambiguous = new HashSet<>();
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > 1) ambiguous.add(e.getKey());
        }
        return ambiguous;
    }

    private List<Outcome> runSequential(List<RasterPair> pairs, Path outputDir, Set<String> ambiguous)
    {
        List<Outcome> outcomes = new ArrayList<>();
        for (RasterPair pair : pairs) {
            outcomes.add(convertOne(pair, outputDir, ambiguous));
        }
        return outcomes;
    }

    // one task per pair; ambiguous stems never write, so output names are unique and need no locking
    private List<Outcome> runParallel(List<RasterPair> pairs, Path outputDir, Set<String> ambiguous)
    {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.getThreads(), pairs.size()));
        try {
            List<Future<Outcome>> futures = new ArrayList<>();
            for (RasterPair pair : pairs) {
                futures.add(pool.submit(() -> convertOne(pair, outputDir, ambiguous)));
            }
            List<Outcome> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), pairs.get(i)));
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    private static Outcome await(Future<Outcome> future, RasterPair pair)
    {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(pair, "interrupted");
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null) ? e.getCause() : e;
            logger.error("Failed to convert {}", pair.getDeformation(), cause);
            return failed(pair, String.valueOf(cause.getMessage()));
        }
    }

    private Outcome convertOne(RasterPair pair, Path outputDir, Set<String> ambiguous)
    {
        if (ambiguous.contains(pair.outputStem())) {
            logger.error("Skipping {}: another deformation raster also writes {}.*", pair.getDeformation(),
                         pair.outputStem());
            return failed(pair, "Date stamp " + pair.getDateStamp() + " matches more than one deformation raster");
        }
        try {
            return new Outcome(converter.convert(pair, outputDir), null);
        } catch (ConversionException e) {
            logger.error("Failed to convert {}: {}", pair.getDeformation(), e.getMessage());
            Path path = (e.getPath() != null) ? e.getPath() : pair.getDeformation();
            return new Outcome(0, new ConversionSummary.Failure(path, e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Unexpected error converting {}", pair.getDeformation(), e);
            return failed(pair, e.toString());
        }
    }

    private static Outcome failed(RasterPair pair, String message)
    {
        return new Outcome(0, new ConversionSummary.Failure(pair.getDeformation(), message));
    }

    private static final class Outcome
    {
        final int points;
        final ConversionSummary.Failure failure;

        Outcome(int points, ConversionSummary.Failure failure)
        {
            this.points = points;
            this.failure = failure;
        }
    }
}
