// RasterReadException.java

package com.openathena.insar.raster;

import java.nio.file.Path;

import com.openathena.insar.ConversionException;

/**
 * Raised when a raster file is missing, in an unsupported format, has a
 * corrupt header or describes an empty grid.
 */
public class RasterReadException extends ConversionException
{
    public RasterReadException(String message, Path path)
    {
        super(message + ": " + path, path);
    }

    public RasterReadException(String message, Path path, Throwable cause)
    {
        super(message + ": " + path, path, cause);
    }
}
