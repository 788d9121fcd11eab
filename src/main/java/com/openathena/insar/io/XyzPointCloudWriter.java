// XyzPointCloudWriter.java

package com.openathena.insar.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.openathena.insar.cloud.PointAttributeSet;
import com.openathena.insar.cloud.PointCloud;

/**
 * Space delimited text: a header line {@code X Y Z <attribute...>} and one
 * line per point.  Numbers use {@link Double#toString(double)}, the shortest
 * text that parses back to the same double, independent of locale.
 */
public class XyzPointCloudWriter implements PointCloudWriter
{
    private static final Logger logger = LoggerFactory.getLogger(XyzPointCloudWriter.class);

    static final char SEPARATOR = ' ';

    @Override
    public String extension() { return "xyz"; }

    @Override
    public void write(PointCloud cloud, Path target) throws PointCloudWriteException
    {
        for (String name : cloud.getAttributes().names()) {
            if (name.chars().anyMatch(Character::isWhitespace)) {
                throw new PointCloudWriteException("Attribute name '" + name + "' contains whitespace", target, null);
            }
        }
        AtomicFiles.write(target, out -> writeXyz(cloud, out));
        logger.debug("Wrote {} points to {}", cloud.size(), target);
    }

    private static void writeXyz(PointCloud cloud, OutputStream out) throws IOException
    {
        PointAttributeSet attributes = cloud.getAttributes();
        List<String> names = attributes.names();
        double[][] columns = new double[names.size()][];
        for (int a = 0; a < names.size(); a++) {
            columns[a] = attributes.values(names.get(a));
        }

        // the caller owns and closes the stream
        Writer w = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        w.write("X Y Z");
        for (String name : names) {
            w.write(SEPARATOR);
            w.write(name);
        }
        w.write('\n');

        StringBuilder line = new StringBuilder(128);
        for (int i = 0; i < cloud.size(); i++) {
            line.setLength(0);
            line.append(cloud.getX(i)).append(SEPARATOR)
                .append(cloud.getY(i)).append(SEPARATOR)
                .append(cloud.getZ(i));
            for (double[] column : columns) {
                line.append(SEPARATOR).append(column[i]);
            }
            line.append('\n');
            w.write(line.toString());
        }
        w.flush();
    }
}
