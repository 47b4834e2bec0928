package com.shoprtc.core.util;

/**
 * Raised when a payload cannot be read from or written to JSON.
 */
public class JsonCodecException extends RuntimeException {

    public JsonCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
