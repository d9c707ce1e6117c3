package com.tarterware.infrafinder.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Address returned by the ViaCEP postal code service.
 */
@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PostalAddress
{
    @JsonProperty("cep")
    private String postalCode;

    @JsonProperty("logradouro")
    private String street;

    @JsonProperty("complemento")
    private String complement;

    @JsonProperty("bairro")
    private String neighborhood;

    @JsonProperty("localidade")
    private String city;

    @JsonProperty("uf")
    private String state;

    // Set by ViaCEP when the postal code is well formed but unknown.
    @JsonProperty("erro")
    private Boolean error;

    public boolean isNotFound()
    {
        return Boolean.TRUE.equals(error);
    }
}
