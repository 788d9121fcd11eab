// DimensionMismatchException.java

package com.openathena.insar.cloud;

import java.nio.file.Path;

import com.openathena.insar.ConversionException;

/** Coherence and deformation grids do not have the same shape. */
public class DimensionMismatchException extends ConversionException
{
    public DimensionMismatchException(String deformationShape, String coherenceShape, Path path)
    {
        super("Coherence grid is " + coherenceShape + " but deformation grid is " + deformationShape
              + (path != null ? ": " + path : ""), path);
    }
}
