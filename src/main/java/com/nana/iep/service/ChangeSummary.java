package com.nana.iep.service;

import com.nana.iep.domain.GoalStatus;
import com.nana.iep.domain.MasterRow;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * ChangeSummary - Immutable outcome of one reconciliation run.
 *
 * <p>A run does not simply succeed or fail: some extract rows may be
 * rejected while the rest are merged. The summary records how many master
 * rows were appended, updated, left unchanged or deferred, the per-row
 * change flag for every student in the batch, and every recoverable row
 * error collected on the way (reader and expander errors).
 *
 * <p>The summary is accumulated through a mutable {@link Builder} and then
 * frozen; {@link #toReportText(List)} renders the plain-text report
 * written next to the extract.
 */
public final class ChangeSummary {

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // -----------------------------------------------------------------------
    // FIELDS
    // -----------------------------------------------------------------------

    private final LocalDateTime   completedAt;
    private final int             appended;
    private final int             updated;
    private final int             unchanged;
    private final int             deferred;
    private final List<RowChange> changes;
    private final List<RowError>  errors;

    private ChangeSummary(Builder builder) {
        this.completedAt = builder.completedAt;
        this.appended    = builder.appended;
        this.updated     = builder.updated;
        this.unchanged   = builder.unchanged;
        this.deferred    = builder.deferred;
        this.changes     = Collections.unmodifiableList(new ArrayList<>(builder.changes));
        this.errors      = Collections.unmodifiableList(new ArrayList<>(builder.errors));
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public LocalDateTime getCompletedAt() { return completedAt; }

    /** @return rows added to the end of the master table */
    public int getAppended()  { return appended; }

    /** @return existing rows whose content changed */
    public int getUpdated()   { return updated; }

    /** @return existing rows present in the batch with no material change */
    public int getUnchanged() { return unchanged; }

    /** @return new students held back by the admission threshold */
    public int getDeferred()  { return deferred; }

    /** @return per-student change flags, in batch order */
    public List<RowChange> getChanges() { return changes; }

    /** @return recoverable row errors, in source row order of detection */
    public List<RowError> getErrors()   { return errors; }

    public int getErrorCount() { return errors.size(); }

    /** @return true when the run appended or updated at least one row */
    public boolean hasChanges() { return appended + updated > 0; }

    /**
     * Returns a one-line summary suitable for the console or a log line.
     *
     * @return e.g. "2 appended, 5 updated, 40 unchanged, 0 deferred, 1 error(s)."
     */
    public String getSummary() {
        return String.format("%d appended, %d updated, %d unchanged, %d deferred, %d error(s).",
                appended, updated, unchanged, deferred, errors.size());
    }

    // -----------------------------------------------------------------------
    // REPORT TEXT GENERATION
    // -----------------------------------------------------------------------

    /**
     * Generates the human-readable change report.
     *
     * <p>STRUCTURE:
     * <pre>
     * ============================================================
     *  IEP Audit - Change Report
     * ============================================================
     *  Completed At  : 2025-02-03 07:00:12
     *  Appended      : 1
     *  ...
     * ------------------------------------------------------------
     *  CHANGED ROWS:
     *  NEW      | S1    | sessions=3 | numeracy=Met | wellbeing=-
     * ------------------------------------------------------------
     *  ROW ERRORS:
     *  Row 7    | S9    | MALFORMED_EXTRACT | sub-record 2: unknown tag 'X'
     * ============================================================
     * </pre>
     *
     * @param trackedGoals goal keywords to show per changed row
     * @return the full report as a multi-line string
     */
    public String toReportText(List<String> trackedGoals) {
        StringBuilder sb = new StringBuilder();
        String line60  = "=".repeat(60);
        String line60d = "-".repeat(60);

        sb.append(line60).append("\n");
        sb.append(" IEP Audit - Change Report\n");
        sb.append(line60).append("\n");
        sb.append(String.format(" %-14s: %s%n", "Completed At", completedAt.format(DISPLAY_FORMAT)));
        sb.append(String.format(" %-14s: %d%n", "Appended",  appended));
        sb.append(String.format(" %-14s: %d%n", "Updated",   updated));
        sb.append(String.format(" %-14s: %d%n", "Unchanged", unchanged));
        sb.append(String.format(" %-14s: %d%n", "Deferred",  deferred));
        sb.append(String.format(" %-14s: %d%n", "Row Errors", errors.size()));
        sb.append(line60d).append("\n");

        List<RowChange> material = new ArrayList<>();
        for (RowChange change : changes) {
            if (change.getKind() != RowChange.Kind.UNCHANGED) {
                material.add(change);
            }
        }
        if (material.isEmpty()) {
            sb.append(" No rows changed.\n");
        } else {
            sb.append(" CHANGED ROWS:\n");
            for (RowChange change : material) {
                sb.append(String.format(" %-9s| %-12s| sessions=%d",
                        change.getKind().name(), change.getStudentCode(), change.getSessionCount()));
                for (String goal : trackedGoals) {
                    sb.append(" | ").append(goal).append('=').append(change.describeGoal(goal));
                }
                sb.append("\n");
            }
        }

        if (!errors.isEmpty()) {
            sb.append(line60d).append("\n");
            sb.append(" ROW ERRORS:\n");
            for (RowError error : errors) {
                sb.append(String.format(" Row %-5d| %-12s| %-18s| %s%n",
                        error.getRowNumber(),
                        error.getStudentCode(),
                        error.getKind().name(),
                        error.getMessage()));
            }
        }

        sb.append(line60).append("\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ChangeSummary{appended=" + appended
               + ", updated=" + updated
               + ", unchanged=" + unchanged
               + ", deferred=" + deferred
               + ", errors=" + errors.size() + "}";
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: RowChange
    // -----------------------------------------------------------------------

    /**
     * Change flag for one student of the batch.
     */
    public static final class RowChange {

        /** What the run did to the student's master row. */
        public enum Kind { NEW, UPDATED, UNCHANGED, DEFERRED }

        private final String    studentCode;
        private final Kind      kind;
        private final MasterRow row;

        /**
         * @param studentCode the student
         * @param kind        the change flag
         * @param row         the resulting row, or the row that would have been
         *                    appended for a deferred student
         */
        public RowChange(String studentCode, Kind kind, MasterRow row) {
            this.studentCode = studentCode;
            this.kind        = kind;
            this.row         = row;
        }

        public String getStudentCode() { return studentCode; }

        public Kind getKind()          { return kind; }

        public MasterRow getRow()      { return row; }

        int getSessionCount() {
            return row == null ? 0 : row.getSummary().getSessionCount();
        }

        String describeGoal(String keyword) {
            if (row == null) return "-";
            Optional<GoalStatus> status = row.goalStatusFor(keyword);
            return status.map(GoalStatus::getDisplayName).orElse("-");
        }

        @Override
        public String toString() {
            return "RowChange{" + studentCode + ", " + kind + "}";
        }
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: RowError
    // -----------------------------------------------------------------------

    /**
     * A recoverable per-row problem. The row was excluded from every summary.
     */
    public static final class RowError {

        /** Where the row was rejected. */
        public enum Kind {
            /** The extract file row could not be parsed into cells. */
            PARSE_ERROR,

            /** The packed column did not follow the extract format. */
            MALFORMED_EXTRACT
        }

        private final int    rowNumber;
        private final String studentCode;
        private final Kind   kind;
        private final String message;

        public RowError(int rowNumber, String studentCode, Kind kind, String message) {
            this.rowNumber   = rowNumber;
            this.studentCode = studentCode == null ? "" : studentCode;
            this.kind        = kind;
            this.message     = message == null ? "" : message;
        }

        public int getRowNumber()      { return rowNumber; }

        public String getStudentCode() { return studentCode; }

        public Kind getKind()          { return kind; }

        public String getMessage()     { return message; }

        @Override
        public String toString() {
            return "RowError{row=" + rowNumber
                   + ", code='" + studentCode + "'"
                   + ", kind=" + kind
                   + ", message='" + message + "'}";
        }
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: Builder
    // -----------------------------------------------------------------------

    /**
     * Builder - Mutable accumulator used by the reconciler during one run.
     */
    public static final class Builder {

        private LocalDateTime         completedAt;
        private int                   appended  = 0;
        private int                   updated   = 0;
        private int                   unchanged = 0;
        private int                   deferred  = 0;
        private final List<RowChange> changes   = new ArrayList<>();
        private final List<RowError>  errors    = new ArrayList<>();

        public Builder addAppended(MasterRow row) {
            changes.add(new RowChange(row.getStudentCode(), RowChange.Kind.NEW, row));
            appended++;
            return this;
        }

        public Builder addUpdated(MasterRow row) {
            changes.add(new RowChange(row.getStudentCode(), RowChange.Kind.UPDATED, row));
            updated++;
            return this;
        }

        public Builder addUnchanged(MasterRow row) {
            changes.add(new RowChange(row.getStudentCode(), RowChange.Kind.UNCHANGED, row));
            unchanged++;
            return this;
        }

        public Builder addDeferred(MasterRow candidate) {
            changes.add(new RowChange(candidate.getStudentCode(), RowChange.Kind.DEFERRED, candidate));
            deferred++;
            return this;
        }

        public Builder addError(RowError error) {
            errors.add(error);
            return this;
        }

        public Builder addErrors(List<RowError> rowErrors) {
            if (rowErrors != null) {
                errors.addAll(rowErrors);
            }
            return this;
        }

        /** Overrides the completion timestamp (defaults to now on build). */
        public Builder completedAt(LocalDateTime timestamp) {
            this.completedAt = timestamp;
            return this;
        }

        public ChangeSummary build() {
            if (completedAt == null) {
                completedAt = LocalDateTime.now();
            }
            return new ChangeSummary(this);
        }
    }
}
