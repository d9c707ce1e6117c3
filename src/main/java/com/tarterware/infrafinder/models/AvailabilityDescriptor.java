package com.tarterware.infrafinder.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

/**
 * Availability of one service category near a location, plus the metadata the
 * category reports. Slots the category does not report are null and left out of the
 * JSON output.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AvailabilityDescriptor
{
    @JsonProperty("disponivel")
    Availability availability;

    @JsonProperty("tipo")
    String type;

    @JsonProperty("data_apuracao")
    String date;

    @JsonProperty("programacao")
    String schedule;

    @JsonProperty("turno")
    String shift;

    @JsonProperty("distritos")
    String district;

    @JsonProperty("cooperativa_responsavel")
    String responsibleParty;
}
