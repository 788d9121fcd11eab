// LasFormat.java
// ASPRS LAS 1.4 layout constants shared by the LAS reader and writer

package com.openathena.insar.io;

final class LasFormat
{
    static final byte[] SIGNATURE = { 'L', 'A', 'S', 'F' };
    static final int VERSION_MAJOR = 1;
    static final int VERSION_MINOR = 4;

    static final int HEADER_SIZE = 375;
    static final int VLR_HEADER_SIZE = 54;

    // global encoding bit 4: CRS is stored as WKT
    static final int GLOBAL_ENCODING_WKT = 1 << 4;

    // point data record format 7: format 6 plus RGB
    static final int POINT_FORMAT = 7;
    static final int POINT_BASE_LENGTH = 36;

    static final String USER_PROJECTION = "LASF_Projection";
    static final int RECORD_OGC_WKT = 2112;
    static final String USER_SPEC = "LASF_Spec";
    static final int RECORD_EXTRA_BYTES = 4;
    static final int EXTRA_BYTES_DESCRIPTOR_SIZE = 192;

    // extra bytes data types
    static final int EXTRA_FLOAT = 9;
    static final int EXTRA_DOUBLE = 10;

    // header field offsets
    static final int OFF_GLOBAL_ENCODING = 6;
    static final int OFF_VERSION = 24;
    static final int OFF_SYSTEM_ID = 26;
    static final int OFF_SOFTWARE = 58;
    static final int OFF_HEADER_SIZE = 94;
    static final int OFF_POINT_DATA = 96;
    static final int OFF_NUM_VLRS = 100;
    static final int OFF_POINT_FORMAT = 104;
    static final int OFF_RECORD_LENGTH = 105;
    static final int OFF_SCALE = 131;
    static final int OFF_OFFSET = 155;
    static final int OFF_BOUNDS = 179;     // maxX, minX, maxY, minY, maxZ, minZ
    static final int OFF_NUM_EVLRS = 243;
    static final int OFF_POINT_COUNT = 247;
    static final int OFF_POINTS_BY_RETURN = 255;

    private LasFormat() { }

    static int baseRecordLength(int pointFormat)
    {
        switch (pointFormat) {
        case 6: return 30;
        case 7: return 36;
        case 8: return 38;
        default: return -1;
        }
    }
}
