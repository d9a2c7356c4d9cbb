package com.nana.iep.domain;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * StudentSummary - Per-student aggregate built from atomic facts.
 *
 * <p>RETAINED STATE:
 * A summary keeps the deduplicated set of {@link SessionFact}s and one
 * {@link GoalObservation} per goal category, not just the visible numbers.
 * The session count, goal status map and last-seen date are all derived
 * from that retained state, so merging two summaries is a set union plus
 * the goal retention rule and can never double-count a session that two
 * overlapping extracts both contain.
 *
 * <p>INVARIANTS:
 * <ul>
 *   <li>{@code getSessionCount() == getSessionFacts().size()}</li>
 *   <li>{@code a.mergedWith(a).equals(a)} (idempotent)</li>
 *   <li>{@code a.mergedWith(b).equals(b.mergedWith(a))} (commutative)</li>
 * </ul>
 *
 * <p>Instances are immutable. Use {@link Builder} to accumulate facts.
 */
public final class StudentSummary {

    private final String                                studentCode;
    private final SortedSet<SessionFact>                sessionFacts;
    private final SortedMap<String, GoalObservation>    goals;

    private StudentSummary(String studentCode,
                           SortedSet<SessionFact> sessionFacts,
                           SortedMap<String, GoalObservation> goals) {
        this.studentCode  = studentCode;
        this.sessionFacts = Collections.unmodifiableSortedSet(new TreeSet<>(sessionFacts));
        this.goals        = Collections.unmodifiableSortedMap(new TreeMap<>(goals));
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public String getStudentCode() { return studentCode; }

    /** @return the distinct session facts observed so far, date order */
    public SortedSet<SessionFact> getSessionFacts() { return sessionFacts; }

    /** @return retained observation per goal category, category order */
    public SortedMap<String, GoalObservation> getGoals() { return goals; }

    /** @return count of distinct session facts */
    public int getSessionCount() { return sessionFacts.size(); }

    /**
     * Returns the latest known status per goal category.
     *
     * @return unmodifiable map of category to status, category order
     */
    public Map<String, GoalStatus> getGoalStatus() {
        Map<String, GoalStatus> view = new LinkedHashMap<>();
        goals.forEach((category, obs) -> view.put(category, obs.getStatus()));
        return Collections.unmodifiableMap(view);
    }

    /** @return true if at least one goal category has been observed */
    public boolean hasGoals() { return !goals.isEmpty(); }

    /**
     * Returns the most recent date of any retained fact.
     *
     * @return the last-seen date, or null for a summary with no facts
     */
    public LocalDate getLastSeenDate() {
        LocalDate latest = sessionFacts.isEmpty() ? null : sessionFacts.last().getDate();
        for (GoalObservation obs : goals.values()) {
            if (latest == null || obs.getObservedOn().isAfter(latest)) {
                latest = obs.getObservedOn();
            }
        }
        return latest;
    }

    // -----------------------------------------------------------------------
    // MERGE
    // -----------------------------------------------------------------------

    /**
     * Merges another summary for the same student into a new summary.
     *
     * <p>Session facts are unioned; goal observations are combined per
     * category with {@link GoalObservation#latest}.
     *
     * @param other the summary to merge; must have the same student code
     * @return the merged summary
     * @throws IllegalArgumentException if the student codes differ
     */
    public StudentSummary mergedWith(StudentSummary other) {
        if (!studentCode.equals(other.studentCode)) {
            throw new IllegalArgumentException("Cannot merge summaries of '"
                    + studentCode + "' and '" + other.studentCode + "'.");
        }
        Builder builder = new Builder(studentCode);
        sessionFacts.forEach(builder::addSession);
        other.sessionFacts.forEach(builder::addSession);
        goals.forEach(builder::observeGoal);
        other.goals.forEach(builder::observeGoal);
        return builder.build();
    }

    // -----------------------------------------------------------------------
    // OBJECT CONTRACT
    // -----------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StudentSummary)) return false;
        StudentSummary that = (StudentSummary) o;
        return studentCode.equals(that.studentCode)
               && sessionFacts.equals(that.sessionFacts)
               && goals.equals(that.goals);
    }

    @Override
    public int hashCode() {
        return Objects.hash(studentCode, sessionFacts, goals);
    }

    @Override
    public String toString() {
        return "StudentSummary{code='" + studentCode + "'"
               + ", sessions=" + getSessionCount()
               + ", goals=" + getGoalStatus()
               + ", lastSeen=" + getLastSeenDate() + "}";
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: Builder
    // -----------------------------------------------------------------------

    /**
     * Builder - Mutable accumulator of facts for one student.
     *
     * <p>Adding the same session twice, or an older goal observation after
     * a newer one, leaves the builder unchanged.
     */
    public static final class Builder {

        private final String                             studentCode;
        private final SortedSet<SessionFact>             sessionFacts = new TreeSet<>();
        private final SortedMap<String, GoalObservation> goals        = new TreeMap<>();

        /**
         * @param studentCode the student code; must not be null or blank
         */
        public Builder(String studentCode) {
            if (studentCode == null || studentCode.isBlank()) {
                throw new IllegalArgumentException("Student code must not be blank.");
            }
            this.studentCode = studentCode;
        }

        public Builder addSession(SessionFact fact) {
            sessionFacts.add(Objects.requireNonNull(fact, "fact"));
            return this;
        }

        public Builder observeGoal(String category, GoalObservation observation) {
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(observation, "observation");
            goals.merge(category, observation, GoalObservation::latest);
            return this;
        }

        /**
         * Adds one normalized record of either type.
         *
         * @param record a record belonging to this builder's student
         * @return this builder for chaining
         * @throws IllegalArgumentException if the record is for another student
         */
        public Builder add(NormalizedRecord record) {
            if (!studentCode.equals(record.getStudentCode())) {
                throw new IllegalArgumentException("Record for '" + record.getStudentCode()
                        + "' added to summary of '" + studentCode + "'.");
            }
            switch (record.getFactType()) {
                case SESSION:
                    return addSession(record.toSessionFact());
                case GOAL:
                    return observeGoal(record.getFactValue(), record.toGoalObservation());
                default:
                    throw new IllegalArgumentException("Unknown fact type: " + record.getFactType());
            }
        }

        public StudentSummary build() {
            return new StudentSummary(studentCode, sessionFacts, goals);
        }
    }
}
