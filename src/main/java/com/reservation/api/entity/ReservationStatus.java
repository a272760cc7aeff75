package com.reservation.api.entity;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a {@link Reservation}.
 * <p>
 * Pending and Confirmed block the employee's time; Cancelled and Completed are terminal
 * and free it again. Listing order and allowed transitions are explicit tables so that the
 * labels can change without touching either.
 */
public enum ReservationStatus {
    PENDING("Pending approval"),
    CONFIRMED("Confirmed"),
    CANCELLED("Cancelled"),
    COMPLETED("Completed");

    private static final Map<ReservationStatus, Integer> LISTING_PRIORITY = new EnumMap<>(Map.of(
            PENDING, 1,
            CONFIRMED, 2,
            COMPLETED, 3,
            CANCELLED, 4
    ));

    private static final Map<ReservationStatus, Set<ReservationStatus>> TRANSITIONS = new EnumMap<>(Map.of(
            PENDING, EnumSet.of(CONFIRMED, CANCELLED),
            CONFIRMED, EnumSet.of(CANCELLED, COMPLETED),
            CANCELLED, EnumSet.noneOf(ReservationStatus.class),
            COMPLETED, EnumSet.noneOf(ReservationStatus.class)
    ));

    /** Statuses that no longer occupy the employee's calendar. */
    public static final Set<ReservationStatus> TERMINAL = EnumSet.of(CANCELLED, COMPLETED);

    /** Pending first, then Confirmed, Completed, Cancelled. */
    public static final Comparator<ReservationStatus> LISTING_ORDER =
            Comparator.comparing(ReservationStatus::listingPriority);

    private final String label;

    ReservationStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public int listingPriority() {
        return LISTING_PRIORITY.get(this);
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(ReservationStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }
}
