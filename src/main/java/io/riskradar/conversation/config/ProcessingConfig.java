package io.riskradar.conversation.config;

import java.time.Duration;

public record ProcessingConfig(
        Integer parallelism,
        Integer minParallelBatch,
        Duration scoringTimeout,
        Boolean publishEvents
) {
    public ProcessingConfig {
        parallelism = parallelism != null && parallelism > 0
                ? parallelism
                : Runtime.getRuntime().availableProcessors();
        minParallelBatch = minParallelBatch != null ? minParallelBatch : 256;
        scoringTimeout = scoringTimeout != null ? scoringTimeout : Duration.ofSeconds(30);
        publishEvents = publishEvents != null ? publishEvents : true;
    }

    public static ProcessingConfig defaults() {
        return new ProcessingConfig(null, null, null, null);
    }

    public long getScoringTimeoutMs() {
        return scoringTimeout.toMillis();
    }
}
