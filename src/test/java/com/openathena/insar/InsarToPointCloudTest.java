package com.openathena.insar;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class InsarToPointCloudTest
{
    @TempDir
    Path tmp;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private int run(String... args)
    {
        return InsarToPointCloud.run(args, out);
    }

    private String output()
    {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testHelp()
    {
        assertEquals(InsarToPointCloud.EXIT_OK, run("--help"));
        assertTrue(output().startsWith("Usage:"));
    }

    @Test
    void testBadArgumentsAreUsageErrors()
    {
        assertEquals(InsarToPointCloud.EXIT_USAGE, run("-s", "zero"));
        assertEquals(InsarToPointCloud.EXIT_USAGE, run("-s", "0"));
        assertEquals(InsarToPointCloud.EXIT_USAGE, run("--bogus", "1"));
        assertEquals(InsarToPointCloud.EXIT_USAGE, run("-i"));
        assertEquals(InsarToPointCloud.EXIT_USAGE, run("info"));
    }

    @Test
    void testConvertWritesOutputsAndSummary() throws Exception
    {
        Path input = Files.createDirectories(tmp.resolve("in"));
        Path output = tmp.resolve("out");
        Path summary = tmp.resolve("summary.json");
        RasterFixtures.writeAsciiGrid(input.resolve("20200101_unwrap.asc"), 4, 4, RasterFixtures.sequence(4, 4));

        int code = run("convert", "-i", input.toString(), "-o", output.toString(), "-s", "2",
                       "--summary", summary.toString());

        assertEquals(InsarToPointCloud.EXIT_OK, code);
        assertTrue(Files.exists(output.resolve("20200101_unwrap.las")));
        assertTrue(Files.exists(output.resolve("20200101_unwrap.xyz")));
        JSONObject json = new JSONObject(Files.readString(summary, StandardCharsets.UTF_8));
        assertEquals(1, json.getInt("converted"));
        assertEquals(4, json.getLong("points"));
    }

    @Test
    void testFailedPairGivesFailureExit() throws Exception
    {
        Path input = Files.createDirectories(tmp.resolve("in"));
        RasterFixtures.writeAsciiGrid(input.resolve("20200101_unwrap.asc"), 4, 4, RasterFixtures.sequence(4, 4));
        RasterFixtures.writeAsciiGrid(input.resolve("20200101_corr.asc"), 3, 4, RasterFixtures.filled(3, 4, 1.0));

        assertEquals(InsarToPointCloud.EXIT_FAILED, run("-i", input.toString(), "-o", tmp.resolve("out").toString()));
    }

    @Test
    void testMissingInputDirectory()
    {
        assertEquals(InsarToPointCloud.EXIT_FAILED, run("-i", tmp.resolve("absent").toString(),
                                                        "-o", tmp.resolve("out").toString()));
    }

    @Test
    void testInfoAndInspect() throws Exception
    {
        Path raster = RasterFixtures.writeAsciiGrid(tmp.resolve("20200101_unwrap.asc"), 4, 4,
                                                    RasterFixtures.sequence(4, 4));
        Path output = tmp.resolve("out");

        assertEquals(InsarToPointCloud.EXIT_OK, run("info", raster.toString()));
        assertTrue(output().contains("Size is 4,4"));

        assertEquals(InsarToPointCloud.EXIT_OK, run("-i", tmp.toString(), "-o", output.toString(), "-s", "2"));
        assertEquals(InsarToPointCloud.EXIT_OK, run("inspect", output.resolve("20200101_unwrap.las").toString()));
        assertTrue(output().contains("Points: 4"));
        assertTrue(output().contains("Attributes: deformation, coherence"));

        assertEquals(InsarToPointCloud.EXIT_FAILED, run("info", tmp.resolve("absent.tif").toString()));
        assertEquals(InsarToPointCloud.EXIT_FAILED, run("inspect", raster.toString()));
    }
}
