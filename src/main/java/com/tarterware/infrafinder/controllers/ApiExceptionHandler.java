package com.tarterware.infrafinder.controllers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.tarterware.infrafinder.exceptions.FatalStartupException;
import com.tarterware.infrafinder.exceptions.LookupException;
import com.tarterware.infrafinder.models.ErrorResponse;

/**
 * Maps failures to the {@code {error, message}} body used by every endpoint. Only
 * {@link LookupException} and Spring's request binding failures are reported as
 * client errors; anything else is a server error.
 */
@RestControllerAdvice
public class ApiExceptionHandler
{
    static final String RELOAD_FAILED = "RECARGA_FALHOU";
    static final String ROUTE_NOT_FOUND = "ROTA_NAO_ENCONTRADA";

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(LookupException.class)
    ResponseEntity<ErrorResponse> handleLookup(LookupException ex)
    {
        if (ex.getStatus().is5xxServerError())
        {
            logger.error("Lookup failed: " + ex.getMessage(), ex);
        }
        else
        {
            logger.info("Lookup rejected with " + ex.getCode() + ": " + ex.getMessage());
        }
        return new ResponseEntity<ErrorResponse>(new ErrorResponse(ex.getCode(), ex.getMessage()), ex.getStatus());
    }

    @ExceptionHandler({ MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class })
    ResponseEntity<ErrorResponse> handleBadRequest(Exception ex)
    {
        return new ResponseEntity<ErrorResponse>(
                new ErrorResponse(LookupException.INVALID_PARAMETER, ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({ NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class })
    ResponseEntity<ErrorResponse> handleUnknownRoute(Exception ex)
    {
        return new ResponseEntity<ErrorResponse>(new ErrorResponse(ROUTE_NOT_FOUND, "Rota não encontrada"),
                HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(FatalStartupException.class)
    ResponseEntity<ErrorResponse> handleReloadFailure(FatalStartupException ex)
    {
        logger.error("Reload failed, previous data still served", ex);
        return new ResponseEntity<ErrorResponse>(new ErrorResponse(RELOAD_FAILED, ex.getMessage()),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ErrorResponse> handleUnexpected(Exception ex)
    {
        logger.error("Unexpected failure", ex);
        return new ResponseEntity<ErrorResponse>(new ErrorResponse(LookupException.INTERNAL_ERROR, "Erro interno"),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
