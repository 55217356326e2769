package com.acme.pubsub.listen;

import com.acme.pubsub.core.ChannelEntry;
import com.acme.pubsub.core.ProcessorNotApplicableException;

public interface NotificationProcessor {

    ProcessingStrategy strategy();

    /**
     * @return number of messages handed to listeners
     */
    int process(ChannelEntry<?> channel, IncomingNotification notification);

    default void checkApplicable(ChannelEntry<?> channel, IncomingNotification notification) {
        if (ProcessingStrategy.select(channel, notification.payload()) != strategy()) {
            throw new ProcessorNotApplicableException(getClass().getSimpleName(), channel.logicalName());
        }
    }
}
