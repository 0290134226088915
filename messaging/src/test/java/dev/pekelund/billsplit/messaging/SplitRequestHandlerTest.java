package dev.pekelund.billsplit.messaging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.billsplit.settlement.BillSplitEngine;
import dev.pekelund.billsplit.settlement.ItemAssignment;
import dev.pekelund.billsplit.settlement.LineItem;
import dev.pekelund.billsplit.settlement.PayerReimbursementEngine;
import dev.pekelund.billsplit.settlement.SplitSession;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SplitRequestHandlerTest {

    private final ObjectMapper objectMapper = new SplitMessagingConfiguration().splitObjectMapper();
    private final SplitMessageMapper mapper = new SplitMessageMapper("All");

    @Test
    void settlesSessionWithRealEngine() {
        SplitRequestHandler handler = new SplitRequestHandler(new PayerReimbursementEngine(), mapper, objectMapper);

        SplitOutcome outcome = handler.handle(dinner("s-1", "Alice"));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.failure()).isNull();
        assertThat(outcome.result().sessionId()).isEqualTo("s-1");
        assertThat(outcome.result().computedSplits()).extracting(SettlementMessage::from).containsExactly("Bob", "Carol");
        assertThat(outcome.result().computedSplits()).extracting(SettlementMessage::amount)
            .allSatisfy(amount -> assertThat(amount).isEqualByComparingTo("10.00"));
    }

    @Test
    void passesMappedSessionToEngine() {
        BillSplitEngine engine = mock(BillSplitEngine.class);
        when(engine.computeSplits(any())).thenReturn(new PayerReimbursementEngine().computeSplits(
            mapper.toSession(dinner("s-2", "Alice"))));
        SplitRequestHandler handler = new SplitRequestHandler(engine, mapper, objectMapper);

        handler.handle(dinner("s-2", "Alice"));

        ArgumentCaptor<SplitSession> captor = ArgumentCaptor.forClass(SplitSession.class);
        verify(engine).computeSplits(captor.capture());
        SplitSession session = captor.getValue();
        assertThat(session.sessionId()).isEqualTo("s-2");
        assertThat(session.items()).extracting(LineItem::assignment).containsExactly(ItemAssignment.everyone());
    }

    @Test
    void reportsEngineRejectionAsFailure() {
        SplitRequestHandler handler = new SplitRequestHandler(new PayerReimbursementEngine(), mapper, objectMapper);

        SplitOutcome outcome = handler.handle(dinner("s-3", "Dave"));

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.failure().sessionId()).isEqualTo("s-3");
        assertThat(outcome.failure().reason()).isEqualTo("INVALID_PAYER");
        assertThat(outcome.failure().message()).contains("'Dave'");
    }

    @Test
    void reportsTotalsMismatchAsFailure() {
        SplitRequestHandler handler = new SplitRequestHandler(new PayerReimbursementEngine(), mapper, objectMapper);
        SplitSessionMessage message = new SplitSessionMessage("s-4", null, List.of("Alice", "Bob"),
            new BigDecimal("50.00"), "Alice",
            List.of(new LineItemMessage(null, "Soup", 1, new BigDecimal("20.00"), List.of("All"))));

        SplitOutcome outcome = handler.handle(message);

        assertThat(outcome.failure().reason()).isEqualTo("TOTALS_DO_NOT_MATCH");
    }

    @Test
    void reportsMalformedRequestWithoutCallingEngine() {
        BillSplitEngine engine = mock(BillSplitEngine.class);
        SplitRequestHandler handler = new SplitRequestHandler(engine, mapper, objectMapper);
        SplitSessionMessage message = new SplitSessionMessage("s-5", null, List.of("Alice"), null, "Alice", List.of());

        SplitOutcome outcome = handler.handle(message);

        assertThat(outcome.failure().reason()).isEqualTo(SplitFailureMessage.INVALID_MESSAGE);
        verifyNoInteractions(engine);
    }

    @Test
    void reportsNullRequest() {
        BillSplitEngine engine = mock(BillSplitEngine.class);
        SplitRequestHandler handler = new SplitRequestHandler(engine, mapper, objectMapper);

        SplitOutcome outcome = handler.handle(null);

        assertThat(outcome.failure().reason()).isEqualTo(SplitFailureMessage.INVALID_MESSAGE);
        verifyNoInteractions(engine);
    }

    @Test
    void rethrowsUnexpectedErrors() {
        BillSplitEngine engine = mock(BillSplitEngine.class);
        when(engine.computeSplits(any())).thenThrow(new IllegalStateException("boom"));
        SplitRequestHandler handler = new SplitRequestHandler(engine, mapper, objectMapper);

        assertThatThrownBy(() -> handler.handle(dinner("s-6", "Alice")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("boom");
    }

    @Test
    void handlesJsonPayloads() throws Exception {
        SplitRequestHandler handler = new SplitRequestHandler(new PayerReimbursementEngine(), mapper, objectMapper);
        String payload = """
            {
              "id": "s-7",
              "participants": ["Alice", "Bob", "Carol"],
              "total_amount": 10.00,
              "paid_by": "Alice",
              "items": [{"name": "Cake", "quantity": 1, "price": 10.00, "assigned_to": ["All"]}]
            }
            """;

        JsonNode reply = objectMapper.readTree(handler.handleJson(payload));

        JsonNode splits = reply.get("result").get("computed_splits");
        assertThat(splits).hasSize(2);
        assertThat(splits.get(0).get("from").asText()).isEqualTo("Bob");
        assertThat(splits.get(0).get("amount").decimalValue()).isEqualByComparingTo("3.33");
        assertThat(splits.get(0).get("explanation").asText()).isEqualTo("Cake: $10.00 ÷ 3 = $3.33");
        assertThat(reply.get("result").get("shares").get("Alice").decimalValue()).isEqualByComparingTo("3.34");
    }

    @Test
    void reportsUnreadableJson() throws Exception {
        SplitRequestHandler handler = new SplitRequestHandler(mock(BillSplitEngine.class), mapper, objectMapper);

        JsonNode reply = objectMapper.readTree(handler.handleJson("{not json"));

        assertThat(reply.get("failure").get("reason").asText()).isEqualTo("INVALID_MESSAGE");
        assertThat(reply.get("failure").get("message").asText()).startsWith("Split request is not valid JSON");
    }

    @Test
    void reportsMissingOrBlankJsonPayload() throws Exception {
        BillSplitEngine engine = mock(BillSplitEngine.class);
        SplitRequestHandler handler = new SplitRequestHandler(engine, mapper, objectMapper);

        for (String payload : new String[] {null, "", "   ", "null"}) {
            JsonNode reply = objectMapper.readTree(handler.handleJson(payload));

            assertThat(reply.has("result")).isFalse();
            assertThat(reply.get("failure").get("reason").asText()).isEqualTo(SplitFailureMessage.INVALID_MESSAGE);
            assertThat(reply.get("failure").get("message").asText()).isEqualTo("Split request is empty");
        }
        verifyNoInteractions(engine);
    }

    private static SplitSessionMessage dinner(String id, String payer) {
        return new SplitSessionMessage(id, null, List.of("Alice", "Bob", "Carol"), new BigDecimal("30.00"), payer,
            List.of(new LineItemMessage("i-1", "Dinner", 1, new BigDecimal("30.00"), List.of("All"))));
    }
}
