package com.acme.pubsub.test;

import com.acme.pubsub.core.Listener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingListener<C> implements Listener<C> {
    private final List<C> received = new CopyOnWriteArrayList<>();

    @Override
    public void onNotification(C channel) {
        received.add(channel);
    }

    public List<C> received() {
        return received;
    }
}
