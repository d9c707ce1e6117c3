package com.tarterware.infrafinder.exceptions;

/**
 * Raised when ingestion produces nothing a query could ever match: an empty canonical
 * store, or a store with no indexable geometry. Aborts service startup.
 */
public class FatalStartupException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    public FatalStartupException(String message)
    {
        super(message);
    }

    public FatalStartupException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
