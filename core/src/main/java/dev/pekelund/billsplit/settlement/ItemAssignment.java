package dev.pekelund.billsplit.settlement;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Describes who shares the cost of a line item.
 *
 * <p>{@link Kind#EVERYONE} splits the item across the whole roster of the session,
 * {@link Kind#SUBSET} across the listed participants only, and {@link Kind#UNASSIGNED}
 * leaves the item out of every participant's share.</p>
 *
 * @param kind         the kind of assignment
 * @param participants the listed participants, only populated for {@link Kind#SUBSET}
 */
public record ItemAssignment(Kind kind, Set<String> participants) {

    private static final ItemAssignment SHARED_BY_EVERYONE = new ItemAssignment(Kind.EVERYONE, Set.of());
    private static final ItemAssignment NOBODY = new ItemAssignment(Kind.UNASSIGNED, Set.of());

    public enum Kind {
        EVERYONE,
        SUBSET,
        UNASSIGNED
    }

    public ItemAssignment {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == Kind.SUBSET) {
            Set<String> copy = new LinkedHashSet<>();
            if (participants != null) {
                for (String participant : participants) {
                    copy.add(Objects.requireNonNull(participant, "participant must not be null"));
                }
            }
            if (copy.isEmpty()) {
                kind = Kind.UNASSIGNED;
            }
            participants = Collections.unmodifiableSet(copy);
        } else {
            participants = Set.of();
        }
    }

    public static ItemAssignment everyone() {
        return SHARED_BY_EVERYONE;
    }

    public static ItemAssignment unassigned() {
        return NOBODY;
    }

    public static ItemAssignment subset(Collection<String> participants) {
        return new ItemAssignment(Kind.SUBSET, participants == null ? null : new LinkedHashSet<>(participants));
    }

    public static ItemAssignment subset(String... participants) {
        return subset(participants == null ? null : Arrays.asList(participants));
    }

    public boolean isAssigned() {
        return kind != Kind.UNASSIGNED;
    }

    /**
     * Whether the given participant carries part of the item's cost. Roster membership is
     * the caller's concern for {@link Kind#EVERYONE}.
     */
    public boolean includes(String participant) {
        return switch (kind) {
            case EVERYONE -> participant != null;
            case SUBSET -> participants.contains(participant);
            case UNASSIGNED -> false;
        };
    }

    /**
     * Number of people the item's cost is divided by.
     *
     * @param rosterSize number of participants in the session
     */
    public int shareCount(int rosterSize) {
        return switch (kind) {
            case EVERYONE -> rosterSize;
            case SUBSET -> participants.size();
            case UNASSIGNED -> 0;
        };
    }
}
