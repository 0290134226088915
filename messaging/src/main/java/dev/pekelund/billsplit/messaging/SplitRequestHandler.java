package dev.pekelund.billsplit.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.billsplit.settlement.BillSplitEngine;
import dev.pekelund.billsplit.settlement.BillSplitException;
import dev.pekelund.billsplit.settlement.SplitResult;
import dev.pekelund.billsplit.settlement.SplitSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Settles sessions received from the scanning front end and turns the outcome into the
 * reply payload.
 */
public class SplitRequestHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(SplitRequestHandler.class);

    private final BillSplitEngine engine;
    private final SplitMessageMapper mapper;
    private final ObjectMapper objectMapper;

    public SplitRequestHandler(BillSplitEngine engine, SplitMessageMapper mapper, ObjectMapper objectMapper) {
        this.engine = engine;
        this.mapper = mapper;
        this.objectMapper = objectMapper;
    }

    public SplitOutcome handle(SplitSessionMessage message) {
        if (message == null) {
            LOGGER.warn("Received null split request");
            return SplitOutcome.failure(new SplitFailureMessage(null, SplitFailureMessage.INVALID_MESSAGE,
                "Split request is empty"));
        }

        String sessionId = message.id();
        try {
            SplitSession session = mapper.toSession(message);
            SplitResult result = engine.computeSplits(session);
            LOGGER.info("Settled session {} with {} settlement(s)", sessionId, result.settlements().size());
            return SplitOutcome.success(mapper.toResultMessage(sessionId, result));
        } catch (SplitMessageException ex) {
            LOGGER.warn("Rejected malformed split request {}: {}", sessionId, ex.getMessage());
            return SplitOutcome.failure(new SplitFailureMessage(sessionId, SplitFailureMessage.INVALID_MESSAGE,
                ex.getMessage()));
        } catch (BillSplitException ex) {
            LOGGER.warn("Session {} cannot be settled ({}): {}", sessionId, ex.getReason(), ex.getMessage());
            return SplitOutcome.failure(mapper.toFailureMessage(sessionId, ex));
        } catch (RuntimeException ex) {
            LOGGER.error("Unexpected error while settling session {}", sessionId, ex);
            throw ex;
        }
    }

    /**
     * JSON-in, JSON-out variant of {@link #handle(SplitSessionMessage)} for transports that
     * carry raw payloads.
     */
    public String handleJson(String payload) {
        if (!StringUtils.hasText(payload)) {
            LOGGER.warn("Received empty split request payload");
            return write(SplitOutcome.failure(new SplitFailureMessage(null, SplitFailureMessage.INVALID_MESSAGE,
                "Split request is empty")));
        }

        SplitOutcome outcome;
        try {
            outcome = handle(objectMapper.readValue(payload, SplitSessionMessage.class));
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Unreadable split request payload: {}", ex.getOriginalMessage());
            outcome = SplitOutcome.failure(new SplitFailureMessage(null, SplitFailureMessage.INVALID_MESSAGE,
                "Split request is not valid JSON: " + ex.getOriginalMessage()));
        }
        return write(outcome);
    }

    private String write(SplitOutcome outcome) {
        try {
            return objectMapper.writeValueAsString(outcome);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize split outcome", ex);
        }
    }
}
