package com.nana.iep.service;

import com.nana.iep.domain.MasterRow;
import com.nana.iep.domain.MasterTable;
import com.nana.iep.domain.StudentSummary;
import com.nana.iep.service.ChangeSummary.RowError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reconciler - Merges a batch of student summaries into the master table.
 *
 * <p>PER STUDENT:
 * <ul>
 *   <li><b>Present</b> - the stored summary is merged with the incoming one
 *       (union of session facts, goal retention rule across old and new) and
 *       identity fields are overlaid with the incoming non-blank values. If
 *       the merged row equals the stored row, the stored instance is kept
 *       and the row counts as unchanged; otherwise it is replaced at the
 *       same position and counts as updated.</li>
 *   <li><b>Absent</b> - a new row is appended after all existing rows, in
 *       batch order, unless the admission threshold of the
 *       {@link ReconcilePolicy} defers it.</li>
 * </ul>
 * Rows never move and are never removed.
 *
 * <p>The whole batch is validated before any row is built, and the input
 * table is never modified: a {@link ReconciliationException} leaves the
 * caller with nothing to persist.
 */
public class Reconciler {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final ReconcilePolicy policy;

    public Reconciler(ReconcilePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    // -----------------------------------------------------------------------
    // PUBLIC API
    // -----------------------------------------------------------------------

    /**
     * Reconciles summaries without identity fields or upstream errors.
     *
     * @see #reconcile(MasterTable, Map, Map, List)
     */
    public ReconciliationResult reconcile(MasterTable existing,
                                          Map<String, StudentSummary> incoming)
            throws ReconciliationException {
        return reconcile(existing, incoming, Collections.emptyMap(), Collections.emptyList());
    }

    /**
     * Reconciles a batch into a new master table.
     *
     * @param existing   the current master table; never modified
     * @param incoming   student code to summary, in batch order
     * @param identities passthrough identity fields per student code
     * @param rowErrors  recoverable errors from earlier stages, copied into
     *                   the change summary
     * @return the new table and its change summary
     * @throws ReconciliationException on a structural violation in the batch
     */
    public ReconciliationResult reconcile(MasterTable existing,
                                          Map<String, StudentSummary> incoming,
                                          Map<String, Map<String, String>> identities,
                                          List<RowError> rowErrors)
            throws ReconciliationException {
        Objects.requireNonNull(existing, "existing");
        Objects.requireNonNull(incoming, "incoming");
        validateBatch(incoming);

        List<MasterRow>       rows    = new ArrayList<>(existing.getRows());
        ChangeSummary.Builder summary = new ChangeSummary.Builder().addErrors(rowErrors);

        for (Map.Entry<String, StudentSummary> entry : incoming.entrySet()) {
            String              code     = entry.getKey();
            StudentSummary      batch    = entry.getValue();
            Map<String, String> identity = identities == null ? null : identities.get(code);
            int                 position = existing.positionOf(code);

            if (position >= 0) {
                MasterRow current = rows.get(position);
                MasterRow merged  = new MasterRow(
                        current.overlayIdentity(identity),
                        current.getSummary().mergedWith(batch));
                if (merged.equals(current)) {
                    summary.addUnchanged(current);
                } else {
                    rows.set(position, merged);
                    summary.addUpdated(merged);
                    log.debug("Updated '{}': {} -> {}", code, current, merged);
                }
            } else {
                MasterRow fresh = new MasterRow(identity, batch);
                if (isDeferred(batch)) {
                    summary.addDeferred(fresh);
                    log.debug("Deferred '{}': {} sessions, no goals (threshold {}).",
                            code, batch.getSessionCount(), policy.getMinSessionsWithoutGoal());
                } else {
                    rows.add(fresh);
                    summary.addAppended(fresh);
                    log.debug("Appended '{}' at position {}.", code, rows.size() - 1);
                }
            }
        }

        ChangeSummary changes = summary.build();
        log.info("Reconciled {} students against {} master rows: {}",
                incoming.size(), existing.size(), changes.getSummary());
        return new ReconciliationResult(MasterTable.of(rows), changes);
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    /**
     * Checks the batch's structural invariants before anything is built.
     */
    private void validateBatch(Map<String, StudentSummary> incoming)
            throws ReconciliationException {
        Set<String> seen = new HashSet<>();
        for (Map.Entry<String, StudentSummary> entry : incoming.entrySet()) {
            String         key     = entry.getKey();
            StudentSummary summary = entry.getValue();
            if (key == null || key.isBlank()) {
                throw new ReconciliationException(key, "Incoming batch contains a blank student code.");
            }
            if (summary == null) {
                throw new ReconciliationException(key, "Incoming batch has no summary for '" + key + "'.");
            }
            if (!key.equals(summary.getStudentCode())) {
                throw new ReconciliationException(key, "Summary for '" + summary.getStudentCode()
                        + "' is filed under key '" + key + "'.");
            }
            if (!seen.add(summary.getStudentCode())) {
                throw new ReconciliationException(key,
                        "Duplicate student code '" + key + "' in incoming batch.");
            }
        }
    }

    private boolean isDeferred(StudentSummary batch) {
        return !batch.hasGoals()
               && batch.getSessionCount() < policy.getMinSessionsWithoutGoal();
    }
}
