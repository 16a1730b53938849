/* (C)2026 */
package com.ammann.clinicalkpi.exception;

/**
 * Exception indicating that a requested admission or sector does not exist.
 *
 * <p>Mapped to HTTP 404 (Not Found) by {@link GlobalExceptionHandler}.
 */
public class ResourceNotFoundException extends ApiException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException admission(String admissionId) {
        return new ResourceNotFoundException("Admission not found: " + admissionId);
    }
}
