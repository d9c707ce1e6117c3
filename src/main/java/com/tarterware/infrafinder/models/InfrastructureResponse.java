package com.tarterware.infrafinder.models;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Builder;
import lombok.Value;

/**
 * Result of an infrastructure lookup. Address fields are only filled when the lookup
 * started from a postal code.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "cep", "logradouro", "bairro", "latitude", "longitude", "servicos" })
public class InfrastructureResponse
{
    @JsonProperty("cep")
    String postalCode;

    @JsonProperty("logradouro")
    String street;

    @JsonProperty("bairro")
    String neighborhood;

    @JsonProperty("latitude")
    double latitude;

    @JsonProperty("longitude")
    double longitude;

    // Keyed by category response key, in category order.
    @JsonProperty("servicos")
    Map<String, AvailabilityDescriptor> services;
}
