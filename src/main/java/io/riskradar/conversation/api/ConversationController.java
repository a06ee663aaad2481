package io.riskradar.conversation.api;

import io.riskradar.conversation.api.dto.AnalysisResult;
import io.riskradar.conversation.api.dto.ErrorResponse;
import io.riskradar.conversation.api.dto.Message;
import io.riskradar.conversation.api.dto.TranscriptRequest;
import io.riskradar.conversation.api.exception.RiskAnalysisException;
import io.riskradar.conversation.api.exception.TranscriptValidationException;
import io.riskradar.conversation.api.service.EventPublisherService;
import io.riskradar.conversation.api.service.RiskDetectionService;
import io.riskradar.conversation.api.service.TranscriptParsingService;
import io.riskradar.conversation.config.RiskDetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/conversations")
public class ConversationController {

    private static final Logger logger = LoggerFactory.getLogger(ConversationController.class);

    private final TranscriptParsingService parsingService;
    private final RiskDetectionService riskDetectionService;
    private final EventPublisherService eventPublisher;
    private final RiskDetectionConfig config;

    public ConversationController(TranscriptParsingService parsingService,
                                  RiskDetectionService riskDetectionService,
                                  EventPublisherService eventPublisher,
                                  RiskDetectionConfig config) {
        this.parsingService = parsingService;
        this.riskDetectionService = riskDetectionService;
        this.eventPublisher = eventPublisher;
        this.config = config;
    }

    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResult> analyze(@RequestBody TranscriptRequest request)
            throws TranscriptValidationException {
        List<Message> messages = parsingService.parse(request != null ? request.messages() : null);
        return ResponseEntity.ok(riskDetectionService.analyze(messages));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean eventPublisherHealthy = eventPublisher.isHealthy();
        var stats = eventPublisher.getStats();

        var healthInfo = Map.of(
            "status", eventPublisherHealthy ? "UP" : "DOWN",
            "service", "Conversation Risk Service",
            "timestamp", LocalDateTime.now(),
            "messaging", Map.of(
                "healthy", eventPublisherHealthy,
                "publishEvents", config.processing().publishEvents(),
                "totalPublished", stats.totalPublished(),
                "totalFailed", stats.totalFailed(),
                "successRate", String.format("%.2f%%", stats.getSuccessRate() * 100)
            )
        );

        return eventPublisherHealthy ?
            ResponseEntity.ok(healthInfo) :
            ResponseEntity.status(503).body(healthInfo);
    }

    @GetMapping("/configuration")
    public RiskDetectionConfig configuration() {
        return config;
    }

    @ExceptionHandler(TranscriptValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(TranscriptValidationException e) {
        logger.warn("Rejected transcript: {} ({})", e.getMessage(), e.getCategory());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(e.getMessage(), e.getCategory(), e.getRecordIndex()));
    }

    @ExceptionHandler(RiskAnalysisException.class)
    public ResponseEntity<ErrorResponse> handleAnalysisFailure(RiskAnalysisException e) {
        logger.error("Risk analysis failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(e.getMessage(), e.getCategory(), null));
    }
}
