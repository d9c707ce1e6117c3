package com.tarterware.infrafinder.utilities;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;

/**
 * Exact planar distance from a point to segments, polylines and multi-part lineal
 * geometries. All distances are Euclidean in the units of the coordinate system.
 */
public class DistanceUtilities
{
    /**
     * Distance from a point to the segment between two vertices. The point is
     * projected onto the line through the vertices, the projection parameter is
     * clamped to [0, 1], and the distance to the clamped point is returned.
     * 
     * @return Distance from (px, py) to segment (x1, y1)-(x2, y2).
     */
    public static double pointToSegmentDistance(double px, double py, double x1, double y1, double x2, double y2)
    {
        double abx = x2 - x1;
        double aby = y2 - y1;
        double ab2 = abx * abx + aby * aby;

        // Degenerate segment: both vertices coincide.
        if (ab2 == 0.0)
        {
            return Math.hypot(px - x1, py - y1);
        }

        double t = ((px - x1) * abx + (py - y1) * aby) / ab2;
        if (t < 0.0)
        {
            t = 0.0;
        }
        else if (t > 1.0)
        {
            t = 1.0;
        }

        double cx = x1 + t * abx;
        double cy = y1 + t * aby;
        return Math.hypot(px - cx, py - cy);
    }

    /**
     * Minimum distance from a point to a polyline, over every consecutive pair of valid
     * vertices. Vertices with non-finite ordinates are skipped.
     * 
     * @param px Point x.
     * @param py Point y.
     * @param vertices Polyline vertices.
     * @return The distance, or positive infinity if fewer than two valid vertices exist.
     */
    public static double pointToPolylineDistance(double px, double py, Coordinate[] vertices)
    {
        double minDistance = Double.POSITIVE_INFINITY;
        Coordinate previous = null;

        for (Coordinate vertex : vertices)
        {
            if (!TopologyUtilities.isValidCoordinate(vertex))
            {
                continue;
            }
            if (previous != null)
            {
                double d = pointToSegmentDistance(px, py, previous.x, previous.y, vertex.x, vertex.y);
                if (d < minDistance)
                {
                    minDistance = d;
                }
            }
            previous = vertex;
        }

        return minDistance;
    }

    /**
     * Minimum distance from a point to a lineal geometry, taken over all of its parts.
     * 
     * @param point Query point.
     * @param geometry A LineString or MultiLineString; null yields infinity.
     * @return The distance, or positive infinity if no part has two valid vertices.
     */
    public static double pointToGeometryDistance(Coordinate point, Geometry geometry)
    {
        if (geometry == null)
        {
            return Double.POSITIVE_INFINITY;
        }

        double best = Double.POSITIVE_INFINITY;
        for (int i = 0; i < geometry.getNumGeometries(); ++i)
        {
            Geometry part = geometry.getGeometryN(i);
            if (!(part instanceof LineString))
            {
                continue;
            }
            double d = pointToPolylineDistance(point.x, point.y, part.getCoordinates());
            if (d < best)
            {
                best = d;
            }
        }
        return best;
    }
}
