package io.kairos.core.channel;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of messaging channels a job can deliver to.
 */
public enum ChannelKind {
    TELEGRAM("telegram"),
    WHATSAPP("whatsapp"),
    DISCORD("discord"),
    SLACK("slack"),
    FEISHU("feishu"),
    EMAIL("email"),
    MOCHAT("mochat"),
    DINGTALK("dingtalk"),
    QQ("qq");

    private final String id;

    ChannelKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<ChannelKind> fromId(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ChannelKind kind : values()) {
            if (kind.id.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
