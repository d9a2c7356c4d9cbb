package com.nana.iep.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * NormalizedRecord - One atomic fact recovered from a packed extract column.
 *
 * <p>For a {@link FactType#SESSION} the value is the session label and the
 * status is null. For a {@link FactType#GOAL} the value is the goal category
 * (lower case) and the status is never null.
 */
public final class NormalizedRecord {

    private final String     studentCode;
    private final FactType   factType;
    private final String     factValue;
    private final LocalDate  factDate;
    private final GoalStatus goalStatus;

    private NormalizedRecord(String studentCode,
                             FactType factType,
                             String factValue,
                             LocalDate factDate,
                             GoalStatus goalStatus) {
        this.studentCode = Objects.requireNonNull(studentCode, "studentCode");
        this.factType    = Objects.requireNonNull(factType, "factType");
        this.factValue   = Objects.requireNonNull(factValue, "factValue");
        this.factDate    = Objects.requireNonNull(factDate, "factDate");
        this.goalStatus  = goalStatus;
    }

    /**
     * Creates a session fact.
     *
     * @param studentCode the owning student
     * @param label       the session label
     * @param date        the session date
     * @return a new SESSION record
     */
    public static NormalizedRecord session(String studentCode, String label, LocalDate date) {
        return new NormalizedRecord(studentCode, FactType.SESSION, label, date, null);
    }

    /**
     * Creates a goal fact.
     *
     * @param studentCode the owning student
     * @param category    the goal category
     * @param status      the recorded status; must not be null
     * @param date        the date the status was recorded
     * @return a new GOAL record
     */
    public static NormalizedRecord goal(String studentCode,
                                        String category,
                                        GoalStatus status,
                                        LocalDate date) {
        return new NormalizedRecord(studentCode, FactType.GOAL, category, date,
                Objects.requireNonNull(status, "status"));
    }

    public String getStudentCode()   { return studentCode; }

    public FactType getFactType()    { return factType; }

    public String getFactValue()     { return factValue; }

    public LocalDate getFactDate()   { return factDate; }

    /** @return the goal status, or null for a session */
    public GoalStatus getGoalStatus() { return goalStatus; }

    /** @return the dedup identity of a session record */
    public SessionFact toSessionFact() {
        return new SessionFact(factDate, factValue);
    }

    /** @return the observation carried by a goal record */
    public GoalObservation toGoalObservation() {
        return new GoalObservation(goalStatus, factDate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizedRecord)) return false;
        NormalizedRecord that = (NormalizedRecord) o;
        return studentCode.equals(that.studentCode)
               && factType == that.factType
               && factValue.equals(that.factValue)
               && factDate.equals(that.factDate)
               && goalStatus == that.goalStatus;
    }

    @Override
    public int hashCode() {
        return Objects.hash(studentCode, factType, factValue, factDate, goalStatus);
    }

    @Override
    public String toString() {
        return "NormalizedRecord{" + studentCode + ", " + factType
               + ", '" + factValue + "', " + factDate
               + (goalStatus == null ? "" : ", " + goalStatus) + "}";
    }
}
