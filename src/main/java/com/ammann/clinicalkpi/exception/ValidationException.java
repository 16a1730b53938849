package com.ammann.clinicalkpi.exception;

/**
 * Exception indicating that a client-supplied parameter does not meet the constraints of
 * the requested report.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for a missing required parameter.
     */
    public static ValidationException missingParameter(String paramName) {
        return new ValidationException(
                String.format("Missing required parameter '%s'", paramName));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
