package com.nana.iep.service;

import com.nana.iep.domain.MasterTable;
import com.nana.iep.domain.RawExtractRow;
import com.nana.iep.repository.MasterTableRepository;
import com.nana.iep.service.ChangeSummary.RowError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * AuditRunServiceImpl - Load, reconcile, save.
 *
 * <p>Nothing is written when the pipeline throws. When a run neither
 * appends nor updates any row the store is not touched either, so a
 * re-run of an already processed extract leaves the stored table
 * byte-for-byte as it was.
 */
public class AuditRunServiceImpl implements AuditRunService {

    private static final Logger log = LoggerFactory.getLogger(AuditRunServiceImpl.class);

    private final MasterTableRepository repository;
    private final AuditPipeline         pipeline;

    /**
     * @param repository the master table store; must not be null
     * @param pipeline   the merge pipeline; must not be null
     */
    public AuditRunServiceImpl(MasterTableRepository repository, AuditPipeline pipeline) {
        if (repository == null || pipeline == null) {
            throw new IllegalArgumentException("Repository and pipeline must not be null.");
        }
        this.repository = repository;
        this.pipeline   = pipeline;
        log.debug("AuditRunServiceImpl instantiated.");
    }

    @Override
    public ChangeSummary runBatch(List<RawExtractRow> rows, List<RowError> readErrors)
            throws ReconciliationException {
        MasterTable before = repository.load();
        log.info("Loaded master table with {} rows.", before.size());

        ReconciliationResult result = pipeline.run(rows, before, readErrors);
        ChangeSummary changes = result.getChangeSummary();

        if (changes.hasChanges()) {
            repository.save(result.getMasterTable());
            log.info("Saved master table with {} rows.", result.getMasterTable().size());
        } else {
            log.info("No appended or updated rows; store left untouched.");
        }
        return changes;
    }

    @Override
    public MasterTable currentTable() {
        return repository.load();
    }
}
