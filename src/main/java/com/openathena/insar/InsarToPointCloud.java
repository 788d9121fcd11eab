// InsarToPointCloud.java
// convert geocoded InSAR deformation rasters into LAS and XYZ point clouds
//
// java -jar insar-pointcloud.jar [-c processing_params.yml] [-i inputDir] [-o outputDir]
//                                [-s stride] [-t threshold] [-j threads] [--summary file.json]
// java -jar insar-pointcloud.jar info <raster>
// java -jar insar-pointcloud.jar inspect <file.las>

package com.openathena.insar;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.openathena.insar.cloud.CellSampler;
import com.openathena.insar.convert.ConversionConfig;
import com.openathena.insar.convert.ConversionConfigLoader;
import com.openathena.insar.convert.ConversionOrchestrator;
import com.openathena.insar.convert.ConversionSummary;
import com.openathena.insar.io.LasPointCloudReader;
import com.openathena.insar.raster.CrsSupport;
import com.openathena.insar.raster.GeoTransform;
import com.openathena.insar.raster.GeocodingMapper;
import com.openathena.insar.raster.RasterGrid;
import com.openathena.insar.raster.RasterReadException;
import com.openathena.insar.raster.RasterReader;

public class InsarToPointCloud
{
    private static final Logger logger = LoggerFactory.getLogger(InsarToPointCloud.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args)
    {
        System.exit(run(args, System.out));
    }

    static void usage(PrintStream out)
    {
        out.println("Usage: InsarToPointCloud [-c config.yml] [-i inputDir] [-o outputDir]");
        out.println("                         [-s stride] [-t coherenceThreshold] [-j threads] [--summary file.json]");
        out.println("       InsarToPointCloud info <raster>");
        out.println("       InsarToPointCloud inspect <file.las>");
    }

    static int run(String[] args, PrintStream out)
    {
        if (args.length > 0 && (args[0].equals("-h") || args[0].equals("--help"))) {
            usage(out);
            return EXIT_OK;
        }
        if (args.length > 0 && args[0].equals("info")) {
            if (args.length != 2) {
                usage(out);
                return EXIT_USAGE;
            }
            return info(Path.of(args[1]), out);
        }
        if (args.length > 0 && args[0].equals("inspect")) {
            if (args.length != 2) {
                usage(out);
                return EXIT_USAGE;
            }
            return inspect(Path.of(args[1]), out);
        }
        return convert(args, out);
    }

    private static int convert(String[] args, PrintStream out)
    {
        ConversionConfig config;
        Path summaryFile = null;
        try {
            Path configFile = null;
            String input = null, output = null, stride = null, threshold = null, threads = null;
            int start = (args.length > 0 && args[0].equals("convert")) ? 1 : 0;
            for (int i = start; i < args.length; i++) {
                String flag = args[i];
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for " + flag);
                }
                String value = args[++i];
                switch (flag) {
                case "-c": case "--config": configFile = Path.of(value); break;
                case "-i": case "--input-dir": input = value; break;
                case "-o": case "--output-dir": output = value; break;
                case "-s": case "--stride": stride = value; break;
                case "-t": case "--threshold": threshold = value; break;
                case "-j": case "--threads": threads = value; break;
                case "--summary": summaryFile = Path.of(value); break;
                default: throw new IllegalArgumentException("Unknown option " + flag);
                }
            }

            config = (configFile != null) ? ConversionConfigLoader.load(configFile) : new ConversionConfig();
            if (input != null) config.setInputDir(Path.of(input));
            if (output != null) config.setOutputDir(Path.of(output));
            if (stride != null) config.setStride(Integer.parseInt(stride));
            if (threshold != null) config.setCoherenceThreshold(Double.parseDouble(threshold));
            if (threads != null) config.setThreads(Integer.parseInt(threads));
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            out.println("Error: " + e.getMessage());
            usage(out);
            return EXIT_USAGE;
        } catch (IOException e) {
            out.println("Unable to load configuration: " + e.getMessage());
            return EXIT_FAILED;
        }

        logger.info("Converting with {}", config);
        ConversionSummary summary;
        try {
            summary = new ConversionOrchestrator(config).run();
        } catch (IOException e) {
            logger.error("Cannot scan input directory {}: {}", config.getInputDir(), e.toString());
            out.println("Input directory not readable: " + config.getInputDir());
            return EXIT_FAILED;
        }

        out.println("Done. Found " + summary.getFound() + " deformation rasters, converted "
                    + summary.getConverted() + ", failed " + summary.getFailed() + ".");

        if (summaryFile != null) {
            try {
                Files.writeString(summaryFile, summary.toJSON().toString(2) + "\n", StandardCharsets.UTF_8);
            } catch (IOException e) {
                logger.error("Unable to write summary {}: {}", summaryFile, e.getMessage());
                return EXIT_FAILED;
            }
        }
        return (summary.getFailed() == 0) ? EXIT_OK : EXIT_FAILED;
    }

    // dimensions, transform, CRS and extent of a raster, in the manner of gdalinfo
    private static int info(Path raster, PrintStream out)
    {
        RasterGrid grid;
        try {
            grid = RasterReader.read(raster);
        } catch (RasterReadException e) {
            out.println(e.getMessage());
            return EXIT_FAILED;
        }

        GeoTransform t = grid.getTransform();
        out.println("File: " + raster);
        out.println("Size is " + grid.getWidth() + "," + grid.getHeight());
        out.printf("Origin = (%.6f, %.6f)%n", t.getOriginX(), t.getOriginY());
        out.printf("Pixel Size = (%.6f, %.6f)%n", t.getPixelWidth(), t.getPixelHeight());
        if (!t.isNorthUp()) {
            out.printf("Rotation = (%.6f, %.6f)%n", t.getRotX(), t.getRotY());
        }
        out.println("CRS: " + CrsSupport.describe(grid.getCrs()));
        out.println("NoData: " + (grid.getNoData() != null ? grid.getNoData() : "none"));

        double[] b = GeocodingMapper.gridBounds(grid.getHeight(), grid.getWidth(), t);
        out.printf("Cell index extent: x %.6f .. %.6f, y %.6f .. %.6f%n", b[0], b[2], b[1], b[3]);

        double[] wgs = CrsSupport.wgs84Bounds(grid);
        if (wgs != null) {
            out.printf("WGS84 extent: lon %.6f .. %.6f, lat %.6f .. %.6f%n", wgs[0], wgs[2], wgs[1], wgs[3]);
        }

        int missing = 0;
        for (int row = 0; row < grid.getHeight(); row++) {
            for (int col = 0; col < grid.getWidth(); col++) {
                if (grid.isMissing(row, col)) missing++;
            }
        }
        out.println("Missing cells: " + missing);
        out.println("Cells at default stride " + ConversionConfig.DEFAULT_STRIDE + ": "
                    + CellSampler.decimatedCount(grid.getHeight(), grid.getWidth(), ConversionConfig.DEFAULT_STRIDE));
        return EXIT_OK;
    }

    private static int inspect(Path las, PrintStream out)
    {
        LasPointCloudReader.LasHeader h;
        try {
            h = LasPointCloudReader.readHeader(las);
        } catch (IOException e) {
            out.println("Unable to read " + las + ": " + e.getMessage());
            return EXIT_FAILED;
        }
        out.println("File: " + las);
        out.println("LAS " + h.versionMajor + "." + h.versionMinor + ", point format " + h.pointFormat
                    + ", record length " + h.recordLength);
        out.println("Points: " + h.pointCount);
        out.println("CRS: " + (h.crs.isEmpty() ? "unknown" : h.crs));
        out.printf("Min: (%.6f, %.6f, %.6f)%n", h.min[0], h.min[1], h.min[2]);
        out.printf("Max: (%.6f, %.6f, %.6f)%n", h.max[0], h.max[1], h.max[2]);
        out.println("Scale: (" + h.scale[0] + ", " + h.scale[1] + ", " + h.scale[2] + ")");
        out.println("Attributes: " + String.join(", ", h.attributeNames));
        return EXIT_OK;
    }
}
