package io.kairos.core.channel;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Routes deliveries to the sender registered for each {@link ChannelKind}.
 */
public final class ChannelRegistry implements ChannelSender {
    private final Map<ChannelKind, ChannelSender> senders = new EnumMap<>(ChannelKind.class);

    public ChannelRegistry register(ChannelKind kind, ChannelSender sender) {
        senders.put(kind, sender);
        return this;
    }

    public Set<ChannelKind> configured() {
        return Collections.unmodifiableSet(senders.keySet());
    }

    @Override
    public void send(String channel, String recipient, String content, Duration timeout) throws DeliveryException {
        ChannelKind kind = ChannelKind.fromId(channel)
            .orElseThrow(() -> new DeliveryException("unknown channel: " + channel));
        ChannelSender sender = senders.get(kind);
        if (sender == null) {
            throw new DeliveryException("channel " + kind.id() + " is not configured");
        }
        sender.send(kind.id(), recipient, content, timeout);
    }
}
