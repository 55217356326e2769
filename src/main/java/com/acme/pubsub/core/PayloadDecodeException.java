package com.acme.pubsub.core;

public class PayloadDecodeException extends PubSubException {
    public PayloadDecodeException(String message) {
        super(message);
    }

    public PayloadDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
