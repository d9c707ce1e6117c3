package com.tarterware.infrafinder.utilities;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;

public class TopologyUtilities
{
    /**
     * Planar CRS of the Belo Horizonte street datasets: SIRGAS 2000 / UTM zone 23S
     * (EPSG:31983).
     */
    public static final String SIRGAS2000_UTM_23S = "+proj=utm +zone=23 +south +ellps=GRS80 +units=m +no_defs";

    /**
     * Get a WGS84 coordinate system that uses geodetic coordinates (latitude, longitude, and elevation).
     * @return A WGS84 geodetic coordinate system.
     */
    static public CoordinateReferenceSystem getWgs84CoordinateSystem()
    {
        CRSFactory crsFactory = new CRSFactory();
        return crsFactory.createFromParameters(null, "+proj=longlat +ellps=WGS84 +datum=WGS84 +no_defs");
    }

    /**
     * Create a planar coordinate system from proj4 parameters.
     * @param proj4Parameters e.g. {@link #SIRGAS2000_UTM_23S}.
     * @return The coordinate system.
     */
    static public CoordinateReferenceSystem getPlanarCoordinateSystem(String proj4Parameters)
    {
        if (StringUtilities.isNullEmptyOrBlank(proj4Parameters))
        {
            throw new IllegalArgumentException("Planar CRS parameters cannot be empty!");
        }
        CRSFactory crsFactory = new CRSFactory();
        return crsFactory.createFromParameters(null, proj4Parameters);
    }

    /**
     * Get a coordinate transformer that converts geodetic WGS84 coordinates into the
     * given planar coordinate system.
     * @param proj4Parameters Parameters of the planar coordinate system.
     * @return A Geodetic to planar coordinate transform.
     */
    static public CoordinateTransform getWgs84ToPlanarCoordinateTransformer(String proj4Parameters)
    {
        CoordinateTransformFactory ctFactory = new CoordinateTransformFactory();
        return ctFactory.createTransform(getWgs84CoordinateSystem(), getPlanarCoordinateSystem(proj4Parameters));
    }

    /**
     * Project a geodetic location into planar coordinates.
     * @param transform Transform from {@link #getWgs84ToPlanarCoordinateTransformer(String)}.
     * @param longitude Degrees longitude.
     * @param latitude Degrees latitude.
     * @return The planar coordinate.
     */
    /**
     * Test whether a latitude/longitude pair is a finite WGS84 location.
     */
    static public boolean isValidGeodetic(double latitude, double longitude)
    {
        return Double.isFinite(latitude) && Math.abs(latitude) <= 90.0
                && Double.isFinite(longitude) && Math.abs(longitude) <= 180.0;
    }

    static public Coordinate toPlanar(CoordinateTransform transform, double longitude, double latitude)
    {
        if (!Double.isFinite(latitude) || Math.abs(latitude) > 90.0)
        {
            throw new IllegalArgumentException("Not a valid latitude: " + latitude);
        }
        if (!Double.isFinite(longitude) || Math.abs(longitude) > 180.0)
        {
            throw new IllegalArgumentException("Not a valid longitude: " + longitude);
        }

        ProjCoordinate projPlanar = new ProjCoordinate();
        transform.transform(new ProjCoordinate(longitude, latitude), projPlanar);
        return projCoordToCoord(projPlanar);
    }

    /**
     * Test whether both ordinates of a coordinate are finite numbers.
     * @param c Coordinate to test; null is invalid.
     * @return true if the coordinate can take part in distance computations.
     */
    static public boolean isValidCoordinate(Coordinate c)
    {
        return c != null && Double.isFinite(c.x) && Double.isFinite(c.y);
    }

    /**
     * Compute the bounding box of a lineal geometry over the parts that hold at least
     * two valid coordinates.
     * @param geometry LineString or MultiLineString.
     * @return The bounding box, or null if no part is usable.
     */
    static public Envelope getUsableEnvelope(Geometry geometry)
    {
        if (geometry == null)
        {
            return null;
        }

        Envelope envelope = new Envelope();
        for (int i = 0; i < geometry.getNumGeometries(); ++i)
        {
            Geometry part = geometry.getGeometryN(i);
            if (!(part instanceof LineString))
            {
                continue;
            }

            Envelope partEnvelope = new Envelope();
            int validCount = 0;
            for (Coordinate c : part.getCoordinates())
            {
                if (isValidCoordinate(c))
                {
                    partEnvelope.expandToInclude(c);
                    validCount++;
                }
            }

            if (validCount >= 2)
            {
                envelope.expandToInclude(partEnvelope);
            }
        }

        return envelope.isNull() ? null : envelope;
    }

    /**
     * Create a Coordinate that has the same properties as the given ProjCoordinate.
     * @param p ProjCoordinate to base new Coordinate on. 
     * @return Coordinate with same location values as given ProjCoordinate.
     */
    static public Coordinate projCoordToCoord(ProjCoordinate p)
    {
        return new Coordinate(p.x, p.y);
    }
}
