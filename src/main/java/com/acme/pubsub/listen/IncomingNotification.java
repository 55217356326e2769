package com.acme.pubsub.listen;

import org.postgresql.PGNotification;

/**
 * A notification as received on the listening connection.
 */
public record IncomingNotification(String channel, String payload, int pid) {

    public static IncomingNotification of(PGNotification notification) {
        return new IncomingNotification(notification.getName(), notification.getParameter(), notification.getPID());
    }
}
