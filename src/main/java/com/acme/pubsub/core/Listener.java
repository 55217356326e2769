package com.acme.pubsub.core;

@FunctionalInterface
public interface Listener<C> {
    void onNotification(C channel);
}
