package com.example.servicerota.exception;

/**
 * Rejected input: malformed availability, qualification or schedule tables.
 * {@code parameters} carries the offending values (a duplicate date, an unknown pool key).
 */
public class BusinessException extends RuntimeException {

    private final String errorCode;
    private final Object[] parameters;

    public BusinessException(String errorCode, String message, Object... parameters) {
        super(message);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getParameters() {
        return parameters;
    }
}
