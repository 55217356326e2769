package com.acme.pubsub.core;

/**
 * A listener loop stopped on an error it could not handle. The cause is the original
 * failure; the loop's connection is already closed.
 */
public class ListenerFailedException extends PubSubException {
    public ListenerFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
