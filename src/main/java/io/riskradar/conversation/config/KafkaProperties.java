package io.riskradar.conversation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "kafka.topics")
public record KafkaProperties(
        String conversationAnalyzed,
        String highRiskDetected
) {}
