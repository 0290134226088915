package dev.pekelund.billsplit.messaging;

import dev.pekelund.billsplit.settlement.BillSplitException;
import dev.pekelund.billsplit.settlement.ItemAssignment;
import dev.pekelund.billsplit.settlement.LineItem;
import dev.pekelund.billsplit.settlement.Settlement;
import dev.pekelund.billsplit.settlement.SettlementWarning;
import dev.pekelund.billsplit.settlement.SplitResult;
import dev.pekelund.billsplit.settlement.SplitSession;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Translates between the stored session format and the engine's model. Upstream marks a
 * line shared by the whole table with a sentinel entry (by default {@code "All"}) in
 * {@code assigned_to}; that sentinel never reaches the engine.
 */
public class SplitMessageMapper {

    private final String everyoneLabel;

    public SplitMessageMapper(String everyoneLabel) {
        if (!StringUtils.hasText(everyoneLabel)) {
            throw new IllegalArgumentException("everyoneLabel must not be blank");
        }
        this.everyoneLabel = everyoneLabel;
    }

    public String getEveryoneLabel() {
        return everyoneLabel;
    }

    /**
     * @throws SplitMessageException when the message lacks a total or carries an invalid line
     */
    public SplitSession toSession(SplitSessionMessage message) {
        Objects.requireNonNull(message, "message must not be null");
        if (message.totalAmount() == null) {
            throw new SplitMessageException("Session " + message.id() + " has no total_amount");
        }

        List<LineItem> items = new ArrayList<>(message.items().size());
        for (int i = 0; i < message.items().size(); i++) {
            items.add(toLineItem(message.items().get(i), i));
        }
        try {
            return new SplitSession(message.id(), message.participants(), message.paidBy(), message.totalAmount(),
                items);
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new SplitMessageException("Invalid session " + message.id() + ": " + ex.getMessage(), ex);
        }
    }

    public ItemAssignment toAssignment(List<String> assignedTo) {
        if (assignedTo == null || assignedTo.isEmpty()) {
            return ItemAssignment.unassigned();
        }
        if (assignedTo.contains(everyoneLabel)) {
            return ItemAssignment.everyone();
        }
        return ItemAssignment.subset(assignedTo);
    }

    public List<String> fromAssignment(ItemAssignment assignment) {
        return switch (assignment.kind()) {
            case EVERYONE -> List.of(everyoneLabel);
            case SUBSET -> List.copyOf(assignment.participants());
            case UNASSIGNED -> List.of();
        };
    }

    public SplitSessionMessage toMessage(SplitSession session) {
        List<LineItemMessage> items = session.items().stream()
            .map(item -> new LineItemMessage(null, item.name(), item.quantity(), item.amount(),
                fromAssignment(item.assignment())))
            .toList();
        return new SplitSessionMessage(session.sessionId(), null, session.participants(), session.enteredTotal(),
            session.payer(), items);
    }

    public SplitResultMessage toResultMessage(String sessionId, SplitResult result) {
        List<SettlementMessage> settlements = result.settlements().stream()
            .map(this::toSettlementMessage)
            .toList();
        List<WarningMessage> warnings = result.warnings().stream()
            .map(this::toWarningMessage)
            .toList();
        return new SplitResultMessage(sessionId, settlements, warnings, result.shares());
    }

    public SplitFailureMessage toFailureMessage(String sessionId, BillSplitException ex) {
        return new SplitFailureMessage(sessionId, ex.getReason().name(), ex.getMessage());
    }

    private LineItem toLineItem(LineItemMessage message, int index) {
        if (message == null) {
            throw new SplitMessageException("Item #" + index + " is empty");
        }
        if (message.price() == null) {
            throw new SplitMessageException("Item '" + message.name() + "' has no price");
        }
        int quantity = message.quantity() != null ? message.quantity() : 1;
        String name = message.name() != null ? message.name() : "";
        try {
            return new LineItem(name, quantity, message.price(), toAssignment(message.assignedTo()));
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new SplitMessageException("Invalid item '" + name + "': " + ex.getMessage(), ex);
        }
    }

    private SettlementMessage toSettlementMessage(Settlement settlement) {
        return new SettlementMessage(settlement.from(), settlement.to(), settlement.amount(),
            settlement.explanation());
    }

    private WarningMessage toWarningMessage(SettlementWarning warning) {
        Long count = warning.type() == SettlementWarning.Type.UNASSIGNED_ITEMS ? warning.count() : null;
        return new WarningMessage(warning.type().name(), warning.message(), warning.allocated(), warning.expected(),
            warning.variancePercent(), count);
    }
}
