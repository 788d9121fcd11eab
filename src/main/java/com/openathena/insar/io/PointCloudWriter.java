// PointCloudWriter.java

package com.openathena.insar.io;

import java.nio.file.Path;

import com.openathena.insar.cloud.PointCloud;

/**
 * Serializes a point cloud to one file format.  Implementations preserve
 * point order and write an empty but well-formed file for an empty cloud.
 */
public interface PointCloudWriter
{
    /** File extension without the dot, e.g. "las". */
    String extension();

    void write(PointCloud cloud, Path target) throws PointCloudWriteException;
}
