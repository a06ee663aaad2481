package io.riskradar.conversation.config;

import java.time.ZoneId;

/**
 * @param zone zone applied to timestamps that carry no offset
 */
public record InputConfig(String zone) {

    public InputConfig {
        zone = zone != null && !zone.isBlank() ? zone : "UTC";
    }

    public static InputConfig defaults() {
        return new InputConfig(null);
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
