package com.vidnyan.dre.domain.error;

/**
 * Base type for failures raised by the dynamic request engine.
 */
public class DynamicRequestException extends RuntimeException {

    public DynamicRequestException(String message) {
        super(message);
    }

    public DynamicRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
