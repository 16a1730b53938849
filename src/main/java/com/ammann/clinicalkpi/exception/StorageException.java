package com.ammann.clinicalkpi.exception;

/**
 * Exception indicating that the clinical record store could not be read or written.
 *
 * <p>Mapped to HTTP 503 (Service Unavailable) by {@link GlobalExceptionHandler}. The KPI
 * engine does not retry; the whole computation fails.
 */
public class StorageException extends ApiException
{
    public StorageException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public StorageException(String message)
    {
        super(message);
    }
}
