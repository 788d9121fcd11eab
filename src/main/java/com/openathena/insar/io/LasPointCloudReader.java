// LasPointCloudReader.java
// read back LAS 1.4 files written by LasPointCloudWriter

package com.openathena.insar.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.openathena.insar.cloud.PointAttributeSet;
import com.openathena.insar.cloud.PointCloud;

import static com.openathena.insar.io.LasFormat.*;

/**
 * Reads LAS 1.4 files with point formats 6 to 8, picking up the WKT CRS
 * record and float or double extra-bytes attributes.  Files whose length
 * disagrees with the point count in their header are rejected.
 */
public final class LasPointCloudReader
{
    private LasPointCloudReader() { }

    /** Header fields of interest. */
    public static final class LasHeader
    {
        public final int versionMajor, versionMinor;
        public final int pointFormat;
        public final int recordLength;
        public final long pointOffset;
        public final long pointCount;
        public final double[] scale = new double[3];
        public final double[] offset = new double[3];
        public final double[] min = new double[3];
        public final double[] max = new double[3];
        public final String crs;
        public final List<String> attributeNames;
        final List<Integer> attributeTypes;
        final List<Integer> attributeOffsets;

        private LasHeader(ByteBuffer h, String crs, List<String> names, List<Integer> types, List<Integer> offsets)
        {
            versionMajor = h.get(OFF_VERSION) & 0xFF;
            versionMinor = h.get(OFF_VERSION + 1) & 0xFF;
            pointFormat = h.get(OFF_POINT_FORMAT) & 0x3F; // top bits flag compression
            recordLength = h.getShort(OFF_RECORD_LENGTH) & 0xFFFF;
            pointOffset = h.getInt(OFF_POINT_DATA) & 0xFFFFFFFFL;
            pointCount = h.getLong(OFF_POINT_COUNT);
            for (int axis = 0; axis < 3; axis++) {
                scale[axis] = h.getDouble(OFF_SCALE + 8 * axis);
                offset[axis] = h.getDouble(OFF_OFFSET + 8 * axis);
                max[axis] = h.getDouble(OFF_BOUNDS + 16 * axis);
                min[axis] = h.getDouble(OFF_BOUNDS + 16 * axis + 8);
            }
            this.crs = crs;
            this.attributeNames = Collections.unmodifiableList(names);
            this.attributeTypes = types;
            this.attributeOffsets = offsets;
        }
    }

    public static LasHeader readHeader(Path path) throws IOException
    {
        try (FileChannel ch = FileChannel.open(path, StandardOpenOption.READ)) {
            return readHeader(ch, path);
        }
    }

    public static PointCloud read(Path path) throws IOException
    {
        try (FileChannel ch = FileChannel.open(path, StandardOpenOption.READ)) {
            LasHeader header = readHeader(ch, path);
            int n = (int) header.pointCount;
            double[] x = new double[n], y = new double[n], z = new double[n];
            int numAttributes = header.attributeNames.size();
            double[][] columns = new double[numAttributes][n];

            ByteBuffer rec = ByteBuffer.allocate(header.recordLength).order(ByteOrder.LITTLE_ENDIAN);
            ch.position(header.pointOffset);
            for (int i = 0; i < n; i++) {
                rec.clear();
                readFully(ch, rec, path);
                x[i] = rec.getInt(0) * header.scale[0] + header.offset[0];
                y[i] = rec.getInt(4) * header.scale[1] + header.offset[1];
                z[i] = rec.getInt(8) * header.scale[2] + header.offset[2];
                for (int a = 0; a < numAttributes; a++) {
                    int pos = header.attributeOffsets.get(a);
                    columns[a][i] = (header.attributeTypes.get(a) == EXTRA_DOUBLE) ? rec.getDouble(pos) : rec.getFloat(pos);
                }
            }

            PointAttributeSet.Builder attributes = PointAttributeSet.builder(n);
            for (int a = 0; a < numAttributes; a++) {
                attributes.put(header.attributeNames.get(a), columns[a]);
            }
            return new PointCloud(x, y, z, attributes.build(), header.crs);
        }
    }

    private static LasHeader readHeader(FileChannel ch, Path path) throws IOException
    {
        long fileSize = ch.size();
        if (fileSize < HEADER_SIZE) {
            throw new IOException("Too short for a LAS 1.4 header: " + path);
        }
        ByteBuffer h = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        ch.position(0);
        readFully(ch, h, path);
        for (int i = 0; i < SIGNATURE.length; i++) {
            if (h.get(i) != SIGNATURE[i]) throw new IOException("Not a LAS file: " + path);
        }
        int major = h.get(OFF_VERSION) & 0xFF, minor = h.get(OFF_VERSION + 1) & 0xFF;
        if (major != VERSION_MAJOR || minor < VERSION_MINOR) {
            throw new IOException("Unsupported LAS version " + major + "." + minor + ": " + path);
        }
        int headerSize = h.getShort(OFF_HEADER_SIZE) & 0xFFFF;
        int pointFormat = h.get(OFF_POINT_FORMAT) & 0x3F;
        int baseLength = baseRecordLength(pointFormat);
        if (baseLength < 0) {
            throw new IOException("Unsupported LAS point format " + pointFormat + ": " + path);
        }
        int recordLength = h.getShort(OFF_RECORD_LENGTH) & 0xFFFF;
        long pointOffset = h.getInt(OFF_POINT_DATA) & 0xFFFFFFFFL;
        long numVlrs = h.getInt(OFF_NUM_VLRS) & 0xFFFFFFFFL;
        long numEvlrs = h.getInt(OFF_NUM_EVLRS) & 0xFFFFFFFFL;
        long pointCount = h.getLong(OFF_POINT_COUNT);

        long expectedEnd = pointOffset + pointCount * recordLength;
        if (pointCount < 0 || pointCount > Integer.MAX_VALUE
            || (numEvlrs == 0 ? fileSize != expectedEnd : fileSize < expectedEnd)) {
            throw new IOException("LAS header claims " + pointCount + " points but file size is "
                                  + fileSize + " bytes: " + path);
        }

        String crs = "";
        List<String> names = new ArrayList<>();
        List<Integer> types = new ArrayList<>();
        List<Integer> offsets = new ArrayList<>();

        long pos = headerSize;
        ByteBuffer vh = ByteBuffer.allocate(VLR_HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        for (long v = 0; v < numVlrs; v++) {
            vh.clear();
            ch.position(pos);
            readFully(ch, vh, path);
            String userId = text(vh, 2, 16);
            int recordId = vh.getShort(18) & 0xFFFF;
            int length = vh.getShort(20) & 0xFFFF;
            ByteBuffer body = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
            readFully(ch, body, path);

            if (USER_PROJECTION.equals(userId) && recordId == RECORD_OGC_WKT) {
                crs = text(body, 0, length);
            }
            else if (USER_SPEC.equals(userId) && recordId == RECORD_EXTRA_BYTES) {
                int fieldOffset = baseLength;
                for (int d = 0; d + EXTRA_BYTES_DESCRIPTOR_SIZE <= length; d += EXTRA_BYTES_DESCRIPTOR_SIZE) {
                    int type = body.get(d + 2) & 0xFF;
                    int width = extraWidth(type, body.get(d + 3) & 0xFF);
                    if (width < 0) {
                        throw new IOException("Unsupported extra bytes data type " + type + ": " + path);
                    }
                    if (type == EXTRA_FLOAT || type == EXTRA_DOUBLE) {
                        names.add(text(body, d + 4, 32));
                        types.add(type);
                        offsets.add(fieldOffset);
                    }
                    fieldOffset += width;
                }
            }
            pos += VLR_HEADER_SIZE + length;
        }

        return new LasHeader(h, crs, names, types, offsets);
    }

    // byte width of an extra bytes field; type 0 keeps its width in the options byte
    private static int extraWidth(int type, int options)
    {
        switch (type) {
        case 0: return options;
        case 1: case 2: return 1;
        case 3: case 4: return 2;
        case 5: case 6: case 9: return 4;
        case 7: case 8: case 10: return 8;
        default: return -1;
        }
    }

    private static void readFully(FileChannel ch, ByteBuffer buf, Path path) throws IOException
    {
        while (buf.hasRemaining()) {
            if (ch.read(buf) < 0) throw new IOException("Unexpected end of LAS file: " + path);
        }
    }

    private static String text(ByteBuffer buf, int pos, int width)
    {
        int end = pos;
        while (end < pos + width && buf.get(end) != 0) end++;
        byte[] bytes = new byte[end - pos];
        for (int i = 0; i < bytes.length; i++) bytes[i] = buf.get(pos + i);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
