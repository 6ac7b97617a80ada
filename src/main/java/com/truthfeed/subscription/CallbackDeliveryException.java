package com.truthfeed.subscription;

public class CallbackDeliveryException extends RuntimeException {

    public CallbackDeliveryException(String message) {
        super(message);
    }

    public CallbackDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
