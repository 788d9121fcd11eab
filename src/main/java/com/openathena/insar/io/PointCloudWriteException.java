// PointCloudWriteException.java

package com.openathena.insar.io;

import java.nio.file.Path;

import com.openathena.insar.ConversionException;

/** Output file could not be written; nothing partial is left behind. */
public class PointCloudWriteException extends ConversionException
{
    public PointCloudWriteException(String message, Path path, Throwable cause)
    {
        super(message + ": " + path, path, cause);
    }
}
