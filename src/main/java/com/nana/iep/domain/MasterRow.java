package com.nana.iep.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MasterRow - One student's row in the cumulative audit master table.
 *
 * <p>A row pairs the passthrough identity columns of the student's most
 * recent extract (name, gender, year level, house) with the
 * {@link StudentSummary} accumulated across every run. Rows are immutable;
 * the reconciler replaces a row with a new instance when its content
 * changes and keeps the existing instance when it does not.
 */
public final class MasterRow {

    /** Identity column used for name ordering in ranked views. */
    public static final String FIELD_STUDENT_NAME = "Student Name";

    private final Map<String, String> identity;
    private final StudentSummary      summary;

    /**
     * @param identity passthrough identity fields; may be null
     * @param summary  the student's accumulated summary; must not be null
     */
    public MasterRow(Map<String, String> identity, StudentSummary summary) {
        this.summary  = Objects.requireNonNull(summary, "summary");
        this.identity = identity == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(identity));
    }

    public String getStudentCode()           { return summary.getStudentCode(); }

    public Map<String, String> getIdentity() { return identity; }

    public StudentSummary getSummary()       { return summary; }

    /** @return the "Student Name" identity field, or "" if absent */
    public String getStudentName() {
        return identity.getOrDefault(FIELD_STUDENT_NAME, "");
    }

    /**
     * Returns a copy of this row whose identity fields are overlaid with the
     * non-blank values of {@code incoming}. Fields absent or blank in the
     * incoming map keep their existing value; field order is existing
     * fields first, then new ones in incoming order.
     *
     * @param incoming identity fields from the latest extract; may be null
     * @return the overlaid identity map
     */
    public Map<String, String> overlayIdentity(Map<String, String> incoming) {
        Map<String, String> merged = new LinkedHashMap<>(identity);
        if (incoming != null) {
            incoming.forEach((field, value) -> {
                if (value != null && !value.isBlank()) {
                    merged.put(field, value);
                }
            });
        }
        return merged;
    }

    // -----------------------------------------------------------------------
    // TRACKED GOAL VIEWS
    // -----------------------------------------------------------------------

    /**
     * Returns true if any goal category contains the keyword.
     * Matching is case-insensitive ("Numeracy" matches "numeracy - fractions").
     *
     * @param keyword the tracked goal keyword
     * @return true if a matching goal has been observed
     */
    public boolean hasGoal(String keyword) {
        return findGoal(keyword).isPresent();
    }

    /**
     * Returns the status of the goal matching the keyword. If several
     * categories match, the observation the retention rule prefers wins.
     *
     * @param keyword the tracked goal keyword
     * @return the status, or empty when no category matches
     */
    public Optional<GoalStatus> goalStatusFor(String keyword) {
        return findGoal(keyword).map(GoalObservation::getStatus);
    }

    private Optional<GoalObservation> findGoal(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return Optional.empty();
        }
        String needle = keyword.trim().toLowerCase(Locale.ROOT);
        GoalObservation best = null;
        for (Map.Entry<String, GoalObservation> e : summary.getGoals().entrySet()) {
            if (e.getKey().toLowerCase(Locale.ROOT).contains(needle)) {
                best = GoalObservation.latest(best, e.getValue());
            }
        }
        return Optional.ofNullable(best);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MasterRow)) return false;
        MasterRow that = (MasterRow) o;
        return identity.equals(that.identity) && summary.equals(that.summary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, summary);
    }

    @Override
    public String toString() {
        return "MasterRow{code='" + getStudentCode() + "'"
               + ", name='" + getStudentName() + "'"
               + ", sessions=" + summary.getSessionCount()
               + ", goals=" + summary.getGoalStatus() + "}";
    }
}
