package com.tarterware.infrafinder.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Failure of a request (bad parameters, postal code, geocoding or service area) that
 * should be reported to the caller with a specific status and error code.
 */
public class LookupException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    public static final String INVALID_POSTAL_CODE = "CEP_INVALIDO";
    public static final String POSTAL_CODE_NOT_FOUND = "CEP_NAO_ENCONTRADO";
    public static final String GEOCODE_NOT_FOUND = "GEOCODE_NAO_ENCONTRADO";
    public static final String INTERNAL_ERROR = "ERRO_INTERNO";
    public static final String INVALID_PARAMETER = "PARAMETRO_INVALIDO";
    public static final String OUTSIDE_SERVICE_AREA = "ENDERECO_FORA_DA_BASE";
    public static final String SERVICE_AREA_MISSING = "BASE_CENTRALIDADE_AUSENTE";

    private final HttpStatus status;

    private final String code;

    public LookupException(HttpStatus status, String code, String message)
    {
        super(message);
        this.status = status;
        this.code = code;
    }

    public LookupException(HttpStatus status, String code, String message, Throwable cause)
    {
        super(message, cause);
        this.status = status;
        this.code = code;
    }

    public HttpStatus getStatus()
    {
        return status;
    }

    public String getCode()
    {
        return code;
    }
}
