package io.kairos.core.channel;

import java.time.Duration;

public interface ChannelSender {
    void send(String channel, String recipient, String content, Duration timeout) throws DeliveryException;
}
