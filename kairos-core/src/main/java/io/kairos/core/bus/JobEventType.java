package io.kairos.core.bus;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum JobEventType {
    @JsonProperty("added")
    ADDED,
    @JsonProperty("enabled")
    ENABLED,
    @JsonProperty("disabled")
    DISABLED,
    @JsonProperty("removed")
    REMOVED,
    @JsonProperty("started")
    STARTED,
    @JsonProperty("succeeded")
    SUCCEEDED,
    @JsonProperty("failed")
    FAILED,
    @JsonProperty("delivery_failed")
    DELIVERY_FAILED
}
