package dev.pekelund.billsplit.settlement;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * A single receipt line.
 *
 * @param name       display label
 * @param quantity   number of units on the line, informational only
 * @param amount     line total as printed on the receipt, not the unit price
 * @param assignment who shares the line total
 */
public record LineItem(String name, int quantity, BigDecimal amount, ItemAssignment assignment) {

    public LineItem {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(amount, "amount must not be null");
        if (quantity < 1) {
            throw new IllegalArgumentException("Quantity of '" + name + "' must be at least 1 but was " + quantity);
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Amount of '" + name + "' must not be negative but was " + amount);
        }
        assignment = assignment != null ? assignment : ItemAssignment.unassigned();
    }

    public LineItem(String name, BigDecimal amount, ItemAssignment assignment) {
        this(name, 1, amount, assignment);
    }

    public BigDecimal unitPrice() {
        return amount.divide(BigDecimal.valueOf(quantity), 2, RoundingMode.HALF_UP);
    }

    public boolean isAssigned() {
        return assignment.isAssigned();
    }

    public boolean isAssignedTo(String participant) {
        return assignment.includes(participant);
    }

    public LineItem withAssignment(ItemAssignment newAssignment) {
        return new LineItem(name, quantity, amount, newAssignment);
    }
}
