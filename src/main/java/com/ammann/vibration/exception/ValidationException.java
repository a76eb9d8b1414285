/* (C)2026 */
package com.ammann.vibration.exception;

import java.util.List;

/**
 * Exception indicating that a client-supplied parameter or sheet does not meet
 * the constraints of the requested diagnosis.
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
     * Creates validation exception for insufficient data.
     */
    public static ValidationException insufficientData(String resourceType, int required, int actual) {
        return new ValidationException(
                String.format("Insufficient %s: need at least %d, but got %d",
                        resourceType, required, actual));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    /**
     * Creates validation exception for a sheet lacking required columns.
     */
    public static ValidationException invalidSchema(String sheetName, List<String> missingColumns) {
        return new ValidationException(
                String.format("Sheet '%s' is missing required columns: %s",
                        sheetName, String.join(", ", missingColumns)));
    }
}
