package com.acme.pubsub.listen;

public enum ListenerState {
    DISCONNECTED,
    LISTENING,
    POLLING,
    DRAINING,
    FAILED,
    STOPPED
}
