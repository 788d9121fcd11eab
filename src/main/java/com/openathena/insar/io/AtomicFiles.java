// AtomicFiles.java

package com.openathena.insar.io;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a file through a temporary sibling that is moved over the target
 * only once its content is complete.  A failed write leaves the target as it
 * was.
 */
final class AtomicFiles
{
    private static final Logger logger = LoggerFactory.getLogger(AtomicFiles.class);

    interface Body
    {
        void writeTo(OutputStream out) throws IOException;
    }

    private AtomicFiles() { }

    static void write(Path target, Body body) throws PointCloudWriteException
    {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, target.getFileName().toString() + ".", ".tmp");
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp), 1 << 16)) {
                body.writeTo(out);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
        } catch (IOException e) {
            throw new PointCloudWriteException("Unable to write point cloud", target, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    logger.warn("Could not remove temporary file {}: {}", tmp, e.getMessage());
                }
            }
        }
    }
}
