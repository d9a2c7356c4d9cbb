package com.nana.iep.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * GoalStatus - Progress state of one IEP goal category.
 *
 * <p>The chronicle system records goal progress as a traffic light
 * ("Green (goal achieved)", "Yellow (progressing)", "Red (no progress)").
 * A goal that is present without any colour ticked is {@link #ACTIVE};
 * a goal explicitly marked as not relevant is {@link #NOT_APPLICABLE}.
 *
 * <p>PRECEDENCE:
 * The declaration order is significant. When two observations of the same
 * category carry the same date, the constant with the higher
 * {@link #precedence()} is retained. {@code NOT_APPLICABLE} always ranks
 * lowest so that any informative state wins a tie against it.
 */
public enum GoalStatus {

    /** Goal recorded, placeholder state, carries no information. */
    NOT_APPLICABLE("Not applicable", "not_applicable", "n/a", "na", "none"),

    /** Goal is present but no progress colour has been recorded. */
    ACTIVE("Active", "active", "open", "present"),

    /** Red: no progress towards the goal. */
    NO_PROGRESS("No progress", "no_progress", "red"),

    /** Yellow: progressing towards the goal. */
    PROGRESSING("Progressing", "progressing", "yellow"),

    /** Green: goal achieved. */
    MET("Met", "met", "achieved", "green");

    // -----------------------------------------------------------------------
    // FIELDS
    // -----------------------------------------------------------------------

    private final String displayName;

    /** Lower-case tokens accepted in a packed extract column. */
    private final String[] tokens;

    GoalStatus(String displayName, String... tokens) {
        this.displayName = displayName;
        this.tokens = tokens;
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    /**
     * Returns the human-readable label used in change reports.
     *
     * @return display name (e.g. "Met", "Not applicable")
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Tie-break rank for observations sharing a date. Higher wins.
     *
     * @return the ordinal of this constant
     */
    public int precedence() {
        return ordinal();
    }

    /**
     * Parses a status token from a packed extract column.
     *
     * <p>Unlike the lenient enum factories used when reading stored data,
     * an unrecognised token is reported as empty: a goal sub-record whose
     * status cannot be read is malformed and the caller rejects the row.
     * Stored values ({@code name()}) are accepted as well as the tokens.
     *
     * @param value the raw token, case-insensitive; may be null
     * @return the matching status, or empty if the token is unknown
     */
    public static Optional<GoalStatus> fromToken(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String token = value.trim().toLowerCase(Locale.ROOT);
        for (GoalStatus status : values()) {
            if (status.name().toLowerCase(Locale.ROOT).equals(token)) {
                return Optional.of(status);
            }
            for (String accepted : status.tokens) {
                if (accepted.equals(token)) {
                    return Optional.of(status);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the enum name, which is also the value persisted to the store.
     *
     * @return the constant name (e.g. "MET")
     */
    @Override
    public String toString() {
        return name();
    }
}
