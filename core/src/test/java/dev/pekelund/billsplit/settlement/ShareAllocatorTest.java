package dev.pekelund.billsplit.settlement;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ShareAllocatorTest {

    private final ShareAllocator allocator = new ShareAllocator();

    @Test
    void startsEveryParticipantAtZeroInRosterOrder() {
        SplitSession session = SplitSession.of(List.of("Carol", "Alice", "Bob"), "Alice", new BigDecimal("4.00"),
            List.of(new LineItem("Soda", new BigDecimal("4.00"), ItemAssignment.subset("Alice"))));

        Map<String, BigDecimal> shares = allocator.allocate(session);

        assertThat(shares.keySet()).containsExactly("Carol", "Alice", "Bob");
        assertThat(shares.get("Carol")).isEqualByComparingTo("0");
        assertThat(shares.get("Alice")).isEqualByComparingTo("4.00");
        assertThat(shares.get("Bob")).isEqualByComparingTo("0");
    }

    @Test
    void dividesEveryoneItemsAcrossRosterAndSubsetItemsAcrossAssignees() {
        SplitSession session = SplitSession.of(List.of("Alice", "Bob", "Carol", "David"), "Alice",
            new BigDecimal("14.00"), List.of(
                new LineItem("Tax", new BigDecimal("4.00"), ItemAssignment.everyone()),
                new LineItem("Nachos", new BigDecimal("10.00"), ItemAssignment.subset("Bob", "Carol"))));

        Map<String, BigDecimal> shares = allocator.allocate(session);

        assertThat(shares.get("Alice")).isEqualByComparingTo("1.00");
        assertThat(shares.get("Bob")).isEqualByComparingTo("6.00");
        assertThat(shares.get("Carol")).isEqualByComparingTo("6.00");
        assertThat(shares.get("David")).isEqualByComparingTo("1.00");
    }

    @Test
    void skipsUnassignedItems() {
        SplitSession session = SplitSession.of(List.of("Alice", "Bob"), "Alice", new BigDecimal("12.00"), List.of(
            new LineItem("Bread", new BigDecimal("2.00"), ItemAssignment.unassigned()),
            new LineItem("Soup", new BigDecimal("10.00"), ItemAssignment.subset("Bob"))));

        Map<String, BigDecimal> shares = allocator.allocate(session);

        assertThat(Amounts.sum(shares.values())).isEqualByComparingTo("10.00");
    }

    @Test
    void doesNotMultiplyByQuantity() {
        SplitSession session = SplitSession.of(List.of("Alice", "Bob"), "Alice", new BigDecimal("15.00"), List.of(
            new LineItem("Beer", 3, new BigDecimal("15.00"), ItemAssignment.subset("Bob"))));

        assertThat(allocator.allocate(session).get("Bob")).isEqualByComparingTo("15.00");
    }

    @Test
    void keepsFractionalCentsUntilReconciliation() {
        SplitSession session = SplitSession.of(List.of("Alice", "Bob", "Carol"), "Alice", new BigDecimal("10.00"),
            List.of(new LineItem("Item", new BigDecimal("10.00"), ItemAssignment.everyone())));

        Map<String, BigDecimal> shares = allocator.allocate(session);

        assertThat(shares.get("Alice")).isEqualByComparingTo("3.3333333333");
    }
}
