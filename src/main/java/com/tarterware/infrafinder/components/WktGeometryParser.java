package com.tarterware.infrafinder.components;

import java.util.Optional;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Lineal;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.tarterware.infrafinder.utilities.StringUtilities;

/**
 * Parses the WKT geometry column of a dataset row into a JTS lineal geometry
 * (LineString or MultiLineString).
 */
@Component
public class WktGeometryParser
{
    private final GeometryFactory geometryFactory = new GeometryFactory();

    private static final Logger logger = LoggerFactory.getLogger(WktGeometryParser.class);

    /**
     * Parse a WKT string.
     *
     * @param wkt Raw geometry serialization.
     * @return The lineal geometry, or empty if the value is blank, malformed, empty or
     *         not lineal.
     */
    public Optional<Geometry> parse(String wkt)
    {
        if (StringUtilities.isNullEmptyOrBlank(wkt))
        {
            return Optional.empty();
        }

        Geometry geometry;
        try
        {
            // WKTReader is not thread-safe, so each call gets its own.
            geometry = new WKTReader(geometryFactory).read(wkt.trim());
        }
        catch (ParseException | IllegalArgumentException e)
        {
            logger.debug("Unparsable geometry: {}", e.getMessage());
            return Optional.empty();
        }

        if (geometry == null || geometry.isEmpty() || !(geometry instanceof Lineal))
        {
            return Optional.empty();
        }

        return Optional.of(geometry);
    }
}
