package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kairos.core.channel.ChannelKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChannelsConfig(
    ChannelConfig telegram,
    ChannelConfig whatsapp,
    ChannelConfig discord,
    ChannelConfig slack,
    ChannelConfig feishu,
    ChannelConfig email,
    ChannelConfig mochat,
    ChannelConfig dingtalk,
    ChannelConfig qq
) {

    public static ChannelsConfig defaults() {
        ChannelConfig off = ChannelConfig.defaults();
        return new ChannelsConfig(off, off, off, off, off, off, off, off, off);
    }

    /**
     * Per-channel settings keyed by kind; a section missing from the file reads as disabled.
     */
    public Map<ChannelKind, ChannelConfig> byKind() {
        Map<ChannelKind, ChannelConfig> map = new EnumMap<>(ChannelKind.class);
        map.put(ChannelKind.TELEGRAM, orDefault(telegram));
        map.put(ChannelKind.WHATSAPP, orDefault(whatsapp));
        map.put(ChannelKind.DISCORD, orDefault(discord));
        map.put(ChannelKind.SLACK, orDefault(slack));
        map.put(ChannelKind.FEISHU, orDefault(feishu));
        map.put(ChannelKind.EMAIL, orDefault(email));
        map.put(ChannelKind.MOCHAT, orDefault(mochat));
        map.put(ChannelKind.DINGTALK, orDefault(dingtalk));
        map.put(ChannelKind.QQ, orDefault(qq));
        return Collections.unmodifiableMap(map);
    }

    private static ChannelConfig orDefault(ChannelConfig config) {
        return config == null ? ChannelConfig.defaults() : config;
    }
}
