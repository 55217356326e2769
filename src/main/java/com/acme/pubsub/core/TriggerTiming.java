package com.acme.pubsub.core;

public enum TriggerTiming {
    BEFORE,
    AFTER
}
