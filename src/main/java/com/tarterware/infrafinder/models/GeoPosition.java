package com.tarterware.infrafinder.models;

import lombok.Value;

/**
 * Geodetic location in WGS84 degrees.
 */
@Value
public class GeoPosition
{
    double latitude;
    double longitude;
}
