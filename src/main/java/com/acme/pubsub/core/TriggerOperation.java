package com.acme.pubsub.core;

public enum TriggerOperation {
    INSERT,
    UPDATE,
    DELETE
}
