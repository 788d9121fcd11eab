// CrsSupport.java
// use Proj4j to describe a raster's CRS and express its extent in WGS84

package com.openathena.insar.raster;

import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CrsSupport
{
    private static final Logger logger = LoggerFactory.getLogger(CrsSupport.class);

    public static final String WGS84 = "EPSG:4326";

    private static final CRSFactory crsFactory = new CRSFactory();
    private static final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();

    private CrsSupport() { }

    /**
     * Resolves an authority:code identifier such as "EPSG:32650".
     *
     * @return the CRS, or null when the identifier is empty or unknown to Proj4j
     */
    public static CoordinateReferenceSystem resolve(String crs)
    {
        if (crs == null || crs.isEmpty()) return null;
        try {
            return crsFactory.createFromName(crs);
        } catch (Proj4jException | IllegalStateException e) {
            logger.debug("Cannot resolve CRS '{}': {}", crs, e.getMessage());
            return null;
        }
    }

    /** Short human readable description, e.g. "EPSG:32650 (+proj=utm +zone=50 ...)". */
    public static String describe(String crs)
    {
        if (crs == null || crs.isEmpty()) return "unknown";
        CoordinateReferenceSystem resolved = resolve(crs);
        if (resolved == null) return crs + " (unresolved)";
        return crs + " (" + resolved.getParameterString().trim() + ")";
    }

    /**
     * Corners of the grid reprojected to WGS84 as {minLon, minLat, maxLon, maxLat}.
     *
     * @return the bounds, or null when the grid's CRS cannot be resolved
     */
    public static double[] wgs84Bounds(RasterGrid grid)
    {
        double[] nativeBounds = GeocodingMapper.gridBounds(grid.getHeight(), grid.getWidth(), grid.getTransform());
        if (WGS84.equals(grid.getCrs())) return nativeBounds;

        CoordinateReferenceSystem source = resolve(grid.getCrs());
        if (source == null) return null;
        CoordinateTransform transform = transformFactory.createTransform(source, crsFactory.createFromName(WGS84));

        double[][] corners = {
            { nativeBounds[0], nativeBounds[1] }, { nativeBounds[0], nativeBounds[3] },
            { nativeBounds[2], nativeBounds[1] }, { nativeBounds[2], nativeBounds[3] }
        };
        double minLon = Double.POSITIVE_INFINITY, minLat = Double.POSITIVE_INFINITY;
        double maxLon = Double.NEGATIVE_INFINITY, maxLat = Double.NEGATIVE_INFINITY;
        try {
            for (double[] c : corners) {
                ProjCoordinate out = new ProjCoordinate();
                transform.transform(new ProjCoordinate(c[0], c[1]), out);
                minLon = Math.min(minLon, out.x);
                maxLon = Math.max(maxLon, out.x);
                minLat = Math.min(minLat, out.y);
                maxLat = Math.max(maxLat, out.y);
            }
        } catch (Proj4jException e) {
            logger.warn("Cannot reproject bounds from {}: {}", grid.getCrs(), e.getMessage());
            return null;
        }
        return new double[] { minLon, minLat, maxLon, maxLat };
    }
}
