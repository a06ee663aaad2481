package io.riskradar.conversation.api.service;

import io.riskradar.conversation.api.dto.Message;
import io.riskradar.conversation.api.dto.TranscriptRecord;
import io.riskradar.conversation.api.exception.ErrorCategory;
import io.riskradar.conversation.api.exception.TranscriptValidationException;
import io.riskradar.conversation.config.RiskDetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw transcript rows into {@link Message} records. Any invalid row rejects the
 * whole batch; the exception carries the zero-based index of the first bad row.
 */
@Service
public class TranscriptParsingService {

    private static final Logger logger = LoggerFactory.getLogger(TranscriptParsingService.class);

    private static final DateTimeFormatter SPACE_SEPARATED =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss][.SSS]");

    private final ZoneId zone;

    public TranscriptParsingService(RiskDetectionConfig config) {
        this.zone = config.input().zoneId();
    }

    public List<Message> parse(List<TranscriptRecord> records) throws TranscriptValidationException {
        if (records == null || records.isEmpty()) return List.of();

        List<Message> messages = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            messages.add(toMessage(records.get(i), i));
        }

        logger.debug("Parsed {} transcript records", messages.size());
        return List.copyOf(messages);
    }

    private Message toMessage(TranscriptRecord record, int index) throws TranscriptValidationException {
        if (record == null) {
            throw new TranscriptValidationException(
                    "Record " + index + " is empty", ErrorCategory.MISSING_FIELD, index);
        }

        requirePresent(record.timestamp(), "timestamp", index);
        requirePresent(record.sender(), "sender", index);
        requirePresent(record.channel(), "channel", index);
        if (record.message() == null) {
            throw new TranscriptValidationException(
                    "Record " + index + " has no message field", ErrorCategory.MISSING_FIELD, index);
        }

        return new Message(
                parseTimestamp(record.timestamp().trim(), index),
                record.sender().trim(),
                record.channel().trim(),
                record.message()
        );
    }

    private void requirePresent(String value, String field, int index) throws TranscriptValidationException {
        if (value == null || value.isBlank()) {
            throw new TranscriptValidationException(
                    "Record " + index + " has no " + field, ErrorCategory.MISSING_FIELD, index);
        }
    }

    /**
     * Accepts ISO-8601 instants and offset date-times, ISO local date-times and the
     * {@code yyyy-MM-dd HH:mm[:ss]} form used by chat exports. Local forms use the configured zone.
     */
    Instant parseTimestamp(String value, int index) throws TranscriptValidationException {
        try {
            return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException notOffset) {
            logger.trace("'{}' is not an offset date-time", value);
        }

        try {
            return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).atZone(zone).toInstant();
        } catch (DateTimeParseException notIsoLocal) {
            logger.trace("'{}' is not an ISO local date-time", value);
        }

        try {
            return LocalDateTime.parse(value, SPACE_SEPARATED).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new TranscriptValidationException(
                    "Record " + index + " has an unparseable timestamp: '" + value + "'",
                    e, ErrorCategory.MALFORMED_TIMESTAMP, index);
        }
    }
}
