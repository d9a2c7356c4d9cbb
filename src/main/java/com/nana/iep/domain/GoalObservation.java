package com.nana.iep.domain;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * GoalObservation - The status of one goal category as of a given date.
 *
 * <p>RETENTION RULE:
 * Of two observations of the same category, the one with the later
 * {@code observedOn} date is kept. On the same date the status with the
 * higher {@link GoalStatus#precedence()} is kept, so an informative status
 * always beats {@link GoalStatus#NOT_APPLICABLE}. The rule is a total order,
 * which makes {@link #latest(GoalObservation, GoalObservation)} commutative
 * and associative: merging the same observations in any order, any number
 * of times, yields the same result.
 */
public final class GoalObservation {

    /** Orders observations so that the retained one compares greatest. */
    public static final Comparator<GoalObservation> RETENTION_ORDER =
            Comparator.comparing(GoalObservation::getObservedOn)
                      .thenComparingInt(o -> o.getStatus().precedence());

    private final GoalStatus status;
    private final LocalDate  observedOn;

    /**
     * @param status     the goal status; must not be null
     * @param observedOn the date the status was recorded; must not be null
     */
    public GoalObservation(GoalStatus status, LocalDate observedOn) {
        this.status     = Objects.requireNonNull(status, "status");
        this.observedOn = Objects.requireNonNull(observedOn, "observedOn");
    }

    public GoalStatus getStatus()    { return status; }

    public LocalDate getObservedOn() { return observedOn; }

    /**
     * Returns whichever observation the retention rule keeps.
     *
     * @param a first observation; may be null
     * @param b second observation; may be null
     * @return the retained observation, or null if both are null
     */
    public static GoalObservation latest(GoalObservation a, GoalObservation b) {
        if (a == null) return b;
        if (b == null) return a;
        return RETENTION_ORDER.compare(a, b) >= 0 ? a : b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GoalObservation)) return false;
        GoalObservation that = (GoalObservation) o;
        return status == that.status && observedOn.equals(that.observedOn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, observedOn);
    }

    @Override
    public String toString() {
        return status + "@" + observedOn;
    }
}
