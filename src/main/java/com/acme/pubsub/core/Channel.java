package com.acme.pubsub.core;

/**
 * Marker for channel records. The record components are the channel contract;
 * the record class itself is the channel identity.
 */
public interface Channel {
}
