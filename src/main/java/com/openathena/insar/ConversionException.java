// ConversionException.java

package com.openathena.insar;

import java.nio.file.Path;

/**
 * Base of the errors a single raster pair conversion can raise.  The
 * orchestrator catches these per pair; they never abort sibling conversions.
 */
public class ConversionException extends Exception
{
    private final transient Path path;

    public ConversionException(String message, Path path)
    {
        super(message);
        this.path = path;
    }

    public ConversionException(String message, Path path, Throwable cause)
    {
        super(message, cause);
        this.path = path;
    }

    /** File the failure relates to, or null when none applies. */
    public Path getPath() { return path; }
}
