// LasPointCloudWriter.java
// write a point cloud as LAS 1.4, point format 7, one float extra-bytes field per attribute

package com.openathena.insar.io;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.openathena.insar.cloud.PointAttributeSet;
import com.openathena.insar.cloud.PointCloud;

import static com.openathena.insar.io.LasFormat.*;

/**
 * LAS 1.4 writer.  Coordinates are stored as scaled 32-bit integers; the
 * scale for each axis is the smallest power of ten that fits the axis range,
 * so precision is at worst half a scale unit.  Attributes are float32 extra
 * bytes declared in insertion order.  Creation date and GUID are left zero so
 * identical clouds produce identical files.
 */
public class LasPointCloudWriter implements PointCloudWriter
{
    private static final Logger logger = LoggerFactory.getLogger(LasPointCloudWriter.class);

    static final String SYSTEM_IDENTIFIER = "EXTRACTION";
    static final String GENERATING_SOFTWARE = "insar-pointcloud";

    static final double MIN_SCALE = 1e-9;
    static final double MAX_SPAN_UNITS = 2.0e9; // just under Integer.MAX_VALUE

    private static final Pattern WKT_PATTERN = Pattern.compile("(?s)[A-Za-z][A-Za-z0-9_]*\\s*\\[.*\\]");

    @Override
    public String extension() { return "las"; }

    @Override
    public void write(PointCloud cloud, Path target) throws PointCloudWriteException
    {
        List<String> names = cloud.getAttributes().names();
        byte[] crsBytes = cloud.getCrs().isEmpty() ? null : (cloud.getCrs() + "\0").getBytes(StandardCharsets.UTF_8);
        if (crsBytes != null && crsBytes.length > 0xFFFF) {
            throw new PointCloudWriteException("CRS identifier too long for a LAS VLR", target, null);
        }
        if (names.size() * EXTRA_BYTES_DESCRIPTOR_SIZE > 0xFFFF) {
            throw new PointCloudWriteException("Too many attributes for a LAS extra bytes VLR", target, null);
        }
        for (String name : names) {
            if (name.getBytes(StandardCharsets.US_ASCII).length > 32) {
                throw new PointCloudWriteException("Attribute name '" + name + "' exceeds 32 bytes", target, null);
            }
        }

        if (crsBytes != null && !looksLikeWkt(cloud.getCrs())) {
            logger.warn("CRS '{}' is not WKT; {} stores it verbatim in the OGC WKT record, which other LAS readers may ignore",
                        cloud.getCrs(), target.getFileName());
        }
        for (double v : cloud.bounds()) {
            if (!Double.isFinite(v)) {
                throw new PointCloudWriteException("Point coordinates must be finite for LAS scaling", target, null);
            }
        }

        AtomicFiles.write(target, out -> writeLas(cloud, names, crsBytes, out));
        logger.debug("Wrote {} points to {}", cloud.size(), target);
    }

    private void writeLas(PointCloud cloud, List<String> names, byte[] crsBytes, OutputStream out) throws IOException
    {
        int recordLength = POINT_BASE_LENGTH + 4 * names.size();
        int numVlrs = 0;
        long pointOffset = HEADER_SIZE;
        if (crsBytes != null) {
            numVlrs++;
            pointOffset += VLR_HEADER_SIZE + crsBytes.length;
        }
        if (!names.isEmpty()) {
            numVlrs++;
            pointOffset += VLR_HEADER_SIZE + (long) EXTRA_BYTES_DESCRIPTOR_SIZE * names.size();
        }

        double[] b = cloud.bounds(); // minX, minY, minZ, maxX, maxY, maxZ
        double[] scale = new double[3];
        double[] offset = new double[3];
        for (int axis = 0; axis < 3; axis++) {
            offset[axis] = Math.floor(b[axis]);
            scale[axis] = scaleFor(b[axis + 3] - offset[axis]);
        }

        ByteBuffer h = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        putText(h, 0, "LASF", 4);
        h.putShort(OFF_GLOBAL_ENCODING, (short) GLOBAL_ENCODING_WKT);
        h.put(OFF_VERSION, (byte) VERSION_MAJOR);
        h.put(OFF_VERSION + 1, (byte) VERSION_MINOR);
        putText(h, OFF_SYSTEM_ID, SYSTEM_IDENTIFIER, 32);
        putText(h, OFF_SOFTWARE, GENERATING_SOFTWARE, 32);
        h.putShort(OFF_HEADER_SIZE, (short) HEADER_SIZE);
        h.putInt(OFF_POINT_DATA, (int) pointOffset);
        h.putInt(OFF_NUM_VLRS, numVlrs);
        h.put(OFF_POINT_FORMAT, (byte) POINT_FORMAT);
        h.putShort(OFF_RECORD_LENGTH, (short) recordLength);
        // legacy point counts stay zero for point format 7
        for (int axis = 0; axis < 3; axis++) {
            h.putDouble(OFF_SCALE + 8 * axis, scale[axis]);
            h.putDouble(OFF_OFFSET + 8 * axis, offset[axis]);
            h.putDouble(OFF_BOUNDS + 16 * axis, b[axis + 3]);
            h.putDouble(OFF_BOUNDS + 16 * axis + 8, b[axis]);
        }
        h.putLong(OFF_POINT_COUNT, cloud.size());
        h.putLong(OFF_POINTS_BY_RETURN, cloud.size()); // every point is a single first return
        out.write(h.array());

        if (crsBytes != null) {
            out.write(vlrHeader(USER_PROJECTION, RECORD_OGC_WKT, crsBytes.length, "OGC coordinate system"));
            out.write(crsBytes);
        }
        if (!names.isEmpty()) {
            out.write(vlrHeader(USER_SPEC, RECORD_EXTRA_BYTES, EXTRA_BYTES_DESCRIPTOR_SIZE * names.size(), "Extra bytes"));
            for (String name : names) {
                out.write(extraBytesDescriptor(name));
            }
        }

        PointAttributeSet attributes = cloud.getAttributes();
        double[][] columns = new double[names.size()][];
        for (int a = 0; a < names.size(); a++) {
            columns[a] = attributes.values(names.get(a));
        }

        ByteBuffer rec = ByteBuffer.allocate(recordLength).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < cloud.size(); i++) {
            rec.clear();
            rec.putInt(encode(cloud.getX(i), scale[0], offset[0]));
            rec.putInt(encode(cloud.getY(i), scale[1], offset[1]));
            rec.putInt(encode(cloud.getZ(i), scale[2], offset[2]));
            rec.putShort((short) 0);       // intensity
            rec.put((byte) 0x11);          // return 1 of 1
            rec.put((byte) 0);             // classification flags, channel, scan direction, edge
            rec.put((byte) 0);             // classification: created, never classified
            rec.put((byte) 0);             // user data
            rec.putShort((short) 0);       // scan angle
            rec.putShort((short) 0);       // point source id
            rec.putDouble(0.0);            // GPS time
            rec.putShort((short) 0);       // red
            rec.putShort((short) 0);       // green
            rec.putShort((short) 0);       // blue
            for (double[] column : columns) {
                rec.putFloat((float) column[i]);
            }
            out.write(rec.array(), 0, recordLength);
        }
    }

    /** True for WKT1 or WKT2 text such as {@code PROJCS["...",...]}, false for identifiers like EPSG:32650. */
    static boolean looksLikeWkt(String crs)
    {
        return WKT_PATTERN.matcher(crs.trim()).matches();
    }

    /** Smallest power of ten keeping {@code span} within the 32-bit range, never below 1e-9. */
    static double scaleFor(double span)
    {
        if (!(span > 0.0)) return MIN_SCALE;
        double exponent = Math.ceil(Math.log10(span / MAX_SPAN_UNITS));
        double scale = Math.pow(10.0, exponent);
        return Math.max(scale, MIN_SCALE);
    }

    static int encode(double v, double scale, double offset)
    {
        return (int) Math.round((v - offset) / scale);
    }

    private static byte[] vlrHeader(String userId, int recordId, int length, String description)
    {
        ByteBuffer v = ByteBuffer.allocate(VLR_HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        putText(v, 2, userId, 16);
        v.putShort(18, (short) recordId);
        v.putShort(20, (short) length);
        putText(v, 22, description, 32);
        return v.array();
    }

    private static byte[] extraBytesDescriptor(String name)
    {
        ByteBuffer d = ByteBuffer.allocate(EXTRA_BYTES_DESCRIPTOR_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        d.put(2, (byte) EXTRA_FLOAT);
        d.put(3, (byte) 0); // no no_data, min, max, scale or offset
        putText(d, 4, name, 32);
        putText(d, 160, name + " values", 32);
        return d.array();
    }

    // fixed width, NUL padded, truncated if too long
    private static void putText(ByteBuffer buf, int pos, String s, int width)
    {
        byte[] bytes = s.getBytes(StandardCharsets.US_ASCII);
        int n = Math.min(bytes.length, width);
        for (int i = 0; i < n; i++) {
            buf.put(pos + i, bytes[i]);
        }
    }
}
