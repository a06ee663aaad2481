package io.riskradar.conversation.config;

import java.time.Duration;

public record GapConfig(
        Duration windowWidth,
        Integer graceWindows,
        WindowAlignment alignment
) {
    public GapConfig {
        windowWidth = windowWidth != null ? windowWidth : Duration.ofMinutes(5);
        graceWindows = graceWindows != null ? graceWindows : 0;
        alignment = alignment != null ? alignment : WindowAlignment.FIRST_MESSAGE;

        if (windowWidth.toMillis() < 1) {
            throw new IllegalArgumentException("risk.gaps.window-width must be at least 1ms");
        }
        if (graceWindows < 0) {
            throw new IllegalArgumentException("risk.gaps.grace-windows must not be negative");
        }
    }

    public static GapConfig defaults() {
        return new GapConfig(null, null, null);
    }

    public enum WindowAlignment {
        FIRST_MESSAGE,  // windows start at the earliest message
        WALL_CLOCK      // windows start at multiples of the width since the epoch
    }
}
