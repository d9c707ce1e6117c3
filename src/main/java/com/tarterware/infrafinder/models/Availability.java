package com.tarterware.infrafinder.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Normalized availability of a service near a location. The labels are the ones
 * published in the lookup response.
 */
public enum Availability
{
    AVAILABLE("Sim"),
    UNAVAILABLE("Não"),

    // Field present on the matched segment, but blank.
    UNKNOWN("não informado"),

    // No segment matched, the column is absent, or the value is unrecognizable.
    NOT_FOUND("não encontrado");

    /**
     * Sentinel reported for pass-through fields that are blank on a matched segment.
     */
    public static final String NOT_INFORMED = "não informado";

    private final String label;

    Availability(String label)
    {
        this.label = label;
    }

    @JsonValue
    public String getLabel()
    {
        return label;
    }

    /**
     * True for the two states that come from an explicit indicator value.
     */
    public boolean isDecisive()
    {
        return this == AVAILABLE || this == UNAVAILABLE;
    }
}
