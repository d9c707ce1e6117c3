package com.tarterware.infrafinder.components;

import java.util.Collections;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.index.strtree.STRtree;

import com.tarterware.infrafinder.utilities.TopologyUtilities;

/**
 * The region covered by the datasets, as a set of polygons in the planar CRS. Built
 * once per ingestion and read-only afterwards.
 */
public final class ServiceArea
{
    private static final ServiceArea MISSING = new ServiceArea(false, Collections.emptyList());

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    private final boolean present;

    private final int polygonCount;

    private final STRtree tree = new STRtree();

    private ServiceArea(boolean present, List<Geometry> polygons)
    {
        this.present = present;
        this.polygonCount = polygons.size();

        for (Geometry polygon : polygons)
        {
            tree.insert(polygon.getEnvelopeInternal(), PreparedGeometryFactory.prepare(polygon));
        }
        tree.build();
    }

    /**
     * @param polygons Polygonal geometries in the planar CRS.
     */
    public static ServiceArea of(List<Geometry> polygons)
    {
        return new ServiceArea(true, polygons);
    }

    /**
     * Area for a run whose region file could not be read. It contains nothing.
     */
    public static ServiceArea missing()
    {
        return MISSING;
    }

    public boolean isPresent()
    {
        return present;
    }

    public int getPolygonCount()
    {
        return polygonCount;
    }

    /**
     * Test whether a planar point lies inside or on the boundary of any polygon.
     *
     * @param point Planar coordinate; non-finite coordinates are never contained.
     */
    public boolean contains(Coordinate point)
    {
        if (!TopologyUtilities.isValidCoordinate(point))
        {
            return false;
        }

        Point p = GEOMETRY_FACTORY.createPoint(point);
        for (Object item : tree.query(new Envelope(point)))
        {
            if (((PreparedGeometry) item).covers(p))
            {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString()
    {
        return present ? "ServiceArea[polygons=" + polygonCount + "]" : "ServiceArea[missing]";
    }
}
