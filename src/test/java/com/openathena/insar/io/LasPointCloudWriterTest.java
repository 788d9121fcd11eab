package com.openathena.insar.io;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.openathena.insar.cloud.PointAttributeSet;
import com.openathena.insar.cloud.PointCloud;

import static org.junit.jupiter.api.Assertions.*;

class LasPointCloudWriterTest
{
    @TempDir
    Path tmp;

    private final LasPointCloudWriter writer = new LasPointCloudWriter();

    static PointCloud sampleCloud()
    {
        double[] x = { 500000.0, 500030.0, 500060.0 };
        double[] y = { 4200000.0, 4199970.0, 4199940.0 };
        double[] z = { -0.0125, 0.0, 0.034 };
        PointAttributeSet attributes = PointAttributeSet.builder(3)
            .put(PointAttributeSet.DEFORMATION, z)
            .put(PointAttributeSet.COHERENCE, new double[] { 0.35, 0.8, 1.0 })
            .build();
        return new PointCloud(x, y, z, attributes, "EPSG:32650");
    }

    @Test
    void testRoundTrip() throws Exception
    {
        Path file = tmp.resolve("20200101_unwrap.las");
        PointCloud cloud = sampleCloud();

        writer.write(cloud, file);
        PointCloud back = LasPointCloudReader.read(file);

        assertEquals(cloud.size(), back.size());
        assertEquals("EPSG:32650", back.getCrs());
        assertEquals(List.of("deformation", "coherence"), back.getAttributes().names());
        for (int i = 0; i < cloud.size(); i++) {
            assertEquals(cloud.getX(i), back.getX(i), 1e-6);
            assertEquals(cloud.getY(i), back.getY(i), 1e-6);
            assertEquals(cloud.getZ(i), back.getZ(i), 1e-6);
            assertEquals(cloud.getZ(i), back.getAttributes().get("deformation", i), 1e-6);
            assertEquals((float) cloud.getAttributes().get("coherence", i), back.getAttributes().get("coherence", i));
        }
    }

    @Test
    void testHeaderFields() throws Exception
    {
        Path file = tmp.resolve("h.las");
        writer.write(sampleCloud(), file);

        LasPointCloudReader.LasHeader h = LasPointCloudReader.readHeader(file);

        assertEquals(1, h.versionMajor);
        assertEquals(4, h.versionMinor);
        assertEquals(7, h.pointFormat);
        assertEquals(36 + 2 * 4, h.recordLength);
        assertEquals(3, h.pointCount);
        assertEquals(500000.0, h.min[0], 1e-6);
        assertEquals(500060.0, h.max[0], 1e-6);
        assertEquals(4199940.0, h.min[1], 1e-6);
        assertEquals(0.034, h.max[2], 1e-9);
        assertEquals(Files.size(file), h.pointOffset + 3L * h.recordLength);
    }

    @Test
    void testEmptyCloudStillDeclaresAttributes() throws Exception
    {
        Path file = tmp.resolve("empty.las");
        PointAttributeSet attributes = PointAttributeSet.builder(0)
            .put(PointAttributeSet.DEFORMATION, new double[0])
            .put(PointAttributeSet.COHERENCE, new double[0])
            .build();

        writer.write(new PointCloud(new double[0], new double[0], new double[0], attributes, ""), file);
        LasPointCloudReader.LasHeader h = LasPointCloudReader.readHeader(file);

        assertEquals(0, h.pointCount);
        assertEquals("", h.crs);
        assertEquals(List.of("deformation", "coherence"), h.attributeNames);
        assertEquals(Files.size(file), h.pointOffset);
        assertTrue(LasPointCloudReader.read(file).isEmpty());
    }

    @Test
    void testRewriteIsByteIdentical() throws Exception
    {
        Path a = tmp.resolve("a.las");
        Path b = tmp.resolve("b.las");

        writer.write(sampleCloud(), a);
        writer.write(sampleCloud(), b);
        byte[] first = Files.readAllBytes(a);
        writer.write(sampleCloud(), a);

        assertArrayEquals(first, Files.readAllBytes(b));
        assertArrayEquals(first, Files.readAllBytes(a));
    }

    @Test
    void testMissingDirectoryFailsWithoutLeftovers() throws Exception
    {
        Path file = tmp.resolve("missing").resolve("x.las");

        PointCloudWriteException e = assertThrows(PointCloudWriteException.class,
                                                  () -> writer.write(sampleCloud(), file));

        assertEquals(file, e.getPath());
        assertFalse(Files.exists(file));
        try (Stream<Path> files = Files.list(tmp)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void testOverlongAttributeNameRejected()
    {
        PointAttributeSet attributes = PointAttributeSet.builder(1)
            .put("an_attribute_name_far_longer_than_32_bytes", new double[] { 1 })
            .build();
        PointCloud cloud = new PointCloud(new double[1], new double[1], new double[1], attributes, "");

        assertThrows(PointCloudWriteException.class, () -> writer.write(cloud, tmp.resolve("long.las")));
        assertFalse(Files.exists(tmp.resolve("long.las")));
    }

    @Test
    void testScaleKeepsSpanInIntegerRange()
    {
        assertEquals(LasPointCloudWriter.MIN_SCALE, LasPointCloudWriter.scaleFor(0.0));
        assertEquals(1e-9, LasPointCloudWriter.scaleFor(1.0), 1e-24);
        for (double span : new double[] { 0.5, 60.0, 1.0e4, 3.0e6, 4.0e7 }) {
            double scale = LasPointCloudWriter.scaleFor(span);
            assertTrue(span / scale <= Integer.MAX_VALUE, "span " + span);
            assertEquals(Math.round(span / scale), LasPointCloudWriter.encode(span, scale, 0.0));
        }
    }

    @Test
    void testReaderRejectsForeignFiles() throws Exception
    {
        Path file = tmp.resolve("bogus.las");
        Files.write(file, new byte[400]);

        assertThrows(java.io.IOException.class, () -> LasPointCloudReader.readHeader(file));
    }

    @Test
    void testNonFiniteCoordinatesRejected()
    {
        double[] z = { 0.5, Double.POSITIVE_INFINITY };
        PointAttributeSet attributes = PointAttributeSet.builder(2).put(PointAttributeSet.DEFORMATION, z).build();
        PointCloud cloud = new PointCloud(new double[] { 0, 1 }, new double[] { 0, 1 }, z, attributes, "");
        Path file = tmp.resolve("inf.las");

        assertThrows(PointCloudWriteException.class, () -> writer.write(cloud, file));
        assertFalse(Files.exists(file));
    }

    @Test
    void testWktIsRecognised()
    {
        assertTrue(LasPointCloudWriter.looksLikeWkt(
            "GEOGCS[\"WGS 84\",DATUM[\"WGS_1984\",SPHEROID[\"WGS 84\",6378137,298.257223563]]]"));
        assertTrue(LasPointCloudWriter.looksLikeWkt("PROJCRS[\"WGS 84 / UTM zone 50N\",\n BASEGEOGCRS[]]"));
        assertFalse(LasPointCloudWriter.looksLikeWkt("EPSG:32650"));
        assertFalse(LasPointCloudWriter.looksLikeWkt("+proj=utm +zone=50"));
    }

    @Test
    void testWktCrsRoundTrip() throws Exception
    {
        String wkt = "GEOGCS[\"WGS 84\",DATUM[\"WGS_1984\",SPHEROID[\"WGS 84\",6378137,298.257223563]],"
                     + "PRIMEM[\"Greenwich\",0],UNIT[\"degree\",0.0174532925199433]]";
        PointCloud cloud = new PointCloud(new double[] { 117.0 }, new double[] { 38.0 }, new double[] { 0.01 },
                                          PointAttributeSet.empty(1), wkt);
        Path file = tmp.resolve("wkt.las");

        writer.write(cloud, file);

        assertEquals(wkt, LasPointCloudReader.readHeader(file).crs);
    }
}
