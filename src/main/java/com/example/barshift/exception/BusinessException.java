package com.example.barshift.exception;

/**
 * Rejected request: malformed input or a state the operation cannot accept.
 * Nothing is mutated when this is thrown.
 */
public class BusinessException extends RuntimeException {

    public static final String INVALID_SHIFT_LABEL = "INVALID_SHIFT_LABEL";
    public static final String DUPLICATE_SHIFT = "DUPLICATE_SHIFT";
    public static final String UNKNOWN_SHIFT = "UNKNOWN_SHIFT";
    public static final String INVALID_WORKER_NAME = "INVALID_WORKER_NAME";
    public static final String INVALID_CONSTRAINT = "INVALID_CONSTRAINT";
    public static final String DUPLICATE_WORKER = "DUPLICATE_WORKER";
    public static final String UNKNOWN_WORKER = "UNKNOWN_WORKER";
    public static final String UNKNOWN_SLOT = "UNKNOWN_SLOT";
    public static final String INVALID_WEEK_START = "INVALID_WEEK_START";
    public static final String WEEK_PUBLISHED = "WEEK_PUBLISHED";
    public static final String WEEK_ALREADY_PUBLISHED = "WEEK_ALREADY_PUBLISHED";
    public static final String PERSISTENCE_ERROR = "PERSISTENCE_ERROR";

    private final String errorCode;
    private final Object[] parameters;

    public BusinessException(String errorCode, String message, Object... parameters) {
        super(message);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public BusinessException(String errorCode, String message, Throwable cause, Object... parameters) {
        super(message, cause);
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
