package com.nana.iep.service;

import com.nana.iep.domain.MasterTable;
import com.nana.iep.domain.RawExtractRow;
import com.nana.iep.domain.StudentSummary;
import com.nana.iep.service.ChangeSummary.RowError;
import com.nana.iep.util.AppLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * AuditPipeline - Expander, then Aggregator, then Reconciler, for one batch.
 *
 * <p>PROCESSING PIPELINE:
 * <ol>
 *   <li>Expand every raw row; malformed rows become row errors.</li>
 *   <li>If no facts remain, skip aggregation and return the existing
 *       table untouched together with the collected errors.</li>
 *   <li>Aggregate facts into one summary per student.</li>
 *   <li>Reconcile the summaries into a new master table.</li>
 * </ol>
 *
 * <p>Single-threaded and synchronous. The pipeline never writes anything;
 * it returns a new table value and the caller persists it.
 */
public class AuditPipeline {

    private static final Logger log = LoggerFactory.getLogger(AuditPipeline.class);

    private final Expander   expander;
    private final Aggregator aggregator;
    private final Reconciler reconciler;

    /**
     * Creates a pipeline with the standard components.
     *
     * @param format the packing convention of the extract
     * @param policy the reconciliation policy
     */
    public AuditPipeline(ExtractFormat format, ReconcilePolicy policy) {
        this(new Expander(format), new Aggregator(), new Reconciler(policy));
    }

    public AuditPipeline(Expander expander, Aggregator aggregator, Reconciler reconciler) {
        this.expander   = Objects.requireNonNull(expander, "expander");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    }

    /**
     * Runs one batch.
     *
     * @see #run(List, MasterTable, List)
     */
    public ReconciliationResult run(List<RawExtractRow> rows, MasterTable master)
            throws ReconciliationException {
        return run(rows, master, Collections.emptyList());
    }

    /**
     * Runs one batch.
     *
     * @param rows       the decoded extract rows
     * @param master     the master table as loaded at the start of the run
     * @param readErrors row errors raised while decoding the extract; they are
     *                   reported ahead of the expander's errors
     * @return the new master table and the change summary
     * @throws ReconciliationException on a fatal invariant violation; no
     *         table is produced
     */
    public ReconciliationResult run(List<RawExtractRow> rows,
                                    MasterTable master,
                                    List<RowError> readErrors)
            throws ReconciliationException {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(master, "master");
        AppLogger.setOperationContext("RECONCILE");
        try {
            log.info("Audit pipeline started: {} extract rows, {} master rows.",
                    rows.size(), master.size());

            ExpansionResult expansion = expander.expand(rows);
            List<RowError> errors = new ArrayList<>(readErrors);
            errors.addAll(expansion.getErrors());

            if (expansion.getRecords().isEmpty()) {
                AppLogger.logWarningEvent("AUDIT_BATCH_EMPTY",
                        "rows=" + rows.size() + ", rejected=" + expansion.getRowsRejected());
                return unchanged(master, errors);
            }

            Map<String, StudentSummary> summaries;
            try {
                summaries = aggregator.aggregate(expansion.getRecords());
            } catch (EmptyGroupException ex) {
                log.warn("Aggregation skipped: {}", ex.getMessage());
                return unchanged(master, errors);
            }

            ReconciliationResult result = reconciler.reconcile(
                    master, summaries, expansion.getIdentities(), errors);
            AppLogger.logEvent("AUDIT_RUN_COMPLETE", result.getChangeSummary().toString());
            return result;

        } catch (ReconciliationException ex) {
            AppLogger.logErrorEvent("AUDIT_RUN_ABORTED",
                    "code=" + ex.getStudentCode(), ex);
            throw ex;
        } finally {
            AppLogger.clearOperationContext();
        }
    }

    private ReconciliationResult unchanged(MasterTable master, List<RowError> errors) {
        ChangeSummary summary = new ChangeSummary.Builder().addErrors(errors).build();
        log.info("No facts in batch; master table left as is. {}", summary.getSummary());
        return new ReconciliationResult(master, summary);
    }
}
