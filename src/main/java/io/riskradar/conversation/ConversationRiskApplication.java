package io.riskradar.conversation;

import io.riskradar.conversation.config.RiskDetectionConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RiskDetectionConfig.class)
@ConfigurationPropertiesScan
public class ConversationRiskApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConversationRiskApplication.class, args);
    }
}
