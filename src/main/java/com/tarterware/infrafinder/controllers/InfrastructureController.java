package com.tarterware.infrafinder.controllers;

import java.util.Locale;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.tarterware.infrafinder.exceptions.LookupException;
import com.tarterware.infrafinder.models.DatasetKind;
import com.tarterware.infrafinder.models.InfrastructureResponse;
import com.tarterware.infrafinder.models.NearestMatch;
import com.tarterware.infrafinder.models.NearestSegmentResponse;
import com.tarterware.infrafinder.services.InfrastructureLookupService;
import com.tarterware.infrafinder.utilities.StringUtilities;

@RestController
public class InfrastructureController
{
    static final String SEGMENT_NOT_FOUND = "TRECHO_NAO_ENCONTRADO";

    @Autowired
    InfrastructureLookupService lookupService;

    @GetMapping("/infra")
    ResponseEntity<InfrastructureResponse> getByPostalCode(@RequestParam(name = "cep", required = false) String cep)
    {
        // A missing cep is reported the same way as a malformed one.
        InfrastructureResponse response = lookupService.lookupByPostalCode(cep);
        return new ResponseEntity<InfrastructureResponse>(response, HttpStatus.OK);
    }

    @GetMapping("/api/infra/point")
    ResponseEntity<InfrastructureResponse> getByPosition(@RequestParam("latitude") double latitude,
            @RequestParam("longitude") double longitude)
    {
        InfrastructureResponse response = lookupService.lookupByPosition(latitude, longitude);
        return new ResponseEntity<InfrastructureResponse>(response, HttpStatus.OK);
    }

    @GetMapping("/api/infra/nearest")
    ResponseEntity<NearestSegmentResponse> getNearest(@RequestParam("x") double x, @RequestParam("y") double y,
            @RequestParam(name = "dataset", required = false) String dataset)
    {
        NearestMatch match = lookupService.findNearest(x, y, parseDataset(dataset))
                .orElseThrow(() -> new LookupException(HttpStatus.NOT_FOUND, SEGMENT_NOT_FOUND,
                        "Nenhum trecho encontrado dentro do raio máximo de busca"));

        return new ResponseEntity<NearestSegmentResponse>(NearestSegmentResponse.from(match), HttpStatus.OK);
    }

    /**
     * Accepts the enum name or its property key, e.g. "SELECTIVE_COLLECTION" or
     * "selective-collection". Blank means any dataset.
     */
    static DatasetKind parseDataset(String dataset)
    {
        if (StringUtilities.isNullEmptyOrBlank(dataset))
        {
            return null;
        }

        String name = dataset.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try
        {
            return DatasetKind.valueOf(name);
        }
        catch (IllegalArgumentException e)
        {
            throw new LookupException(HttpStatus.BAD_REQUEST, LookupException.INVALID_PARAMETER,
                    "Dataset desconhecido: " + dataset, e);
        }
    }
}
