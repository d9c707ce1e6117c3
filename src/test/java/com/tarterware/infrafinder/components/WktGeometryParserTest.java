package com.tarterware.infrafinder.components;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Geometry;

class WktGeometryParserTest
{
    private final WktGeometryParser parser = new WktGeometryParser();

    @Test
    void testParsesLineString()
    {
        Optional<Geometry> geometry = parser.parse(" LINESTRING (600000 7800000, 600100 7800000) ");
        assertTrue(geometry.isPresent());
        assertEquals("LineString", geometry.get().getGeometryType());
        assertEquals(100.0, geometry.get().getLength(), 1e-9);
    }

    @Test
    void testParsesMultiLineString()
    {
        Optional<Geometry> geometry = parser.parse("MULTILINESTRING ((0 0, 1 0), (5 5, 6 6))");
        assertTrue(geometry.isPresent());
        assertEquals(2, geometry.get().getNumGeometries());
    }

    @Test
    void testRejectsBlankAndMalformed()
    {
        assertFalse(parser.parse(null).isPresent());
        assertFalse(parser.parse("   ").isPresent());
        assertFalse(parser.parse("LINESTRING (NOT A GEOMETRY)").isPresent());
        assertFalse(parser.parse("LINESTRING (0 0, 1 1").isPresent());
    }

    @Test
    void testRejectsEmptyAndNonLineal()
    {
        assertFalse(parser.parse("LINESTRING EMPTY").isPresent());
        assertFalse(parser.parse("POINT (1 2)").isPresent());
        assertFalse(parser.parse("POLYGON ((0 0, 1 0, 1 1, 0 0))").isPresent());
    }
}
