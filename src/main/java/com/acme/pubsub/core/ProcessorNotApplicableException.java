package com.acme.pubsub.core;

public class ProcessorNotApplicableException extends PubSubException {
    public ProcessorNotApplicableException(String processor, String channel) {
        super(processor + " cannot handle notification on " + channel);
    }
}
