package com.cronq.internal;

/**
 * The stored JSON payload could not be read into the worker's payload type.
 */
public class PayloadDeserializationException extends Exception {

    public PayloadDeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
