package com.nana.iep.service;

import com.nana.iep.domain.MasterTable;
import com.nana.iep.domain.RawExtractRow;
import com.nana.iep.service.ChangeSummary.RowError;

import java.util.List;

/**
 * AuditRunService - One weekly audit run against the stored master table.
 *
 * <p>EXCEPTION CONTRACT:
 * A fatal {@link ReconciliationException} is declared and nothing is saved
 * when it is thrown. Storage failures surface as the unchecked
 * {@code MasterTableRepository.RepositoryException}.
 */
public interface AuditRunService {

    /**
     * Loads the master table, runs the pipeline on the batch and saves the
     * result. The table is saved only when the run completes.
     *
     * @param rows       the decoded extract rows
     * @param readErrors row errors raised while decoding the extract
     * @return the change summary of the run
     * @throws ReconciliationException if the batch violates a structural invariant
     */
    ChangeSummary runBatch(List<RawExtractRow> rows, List<RowError> readErrors)
            throws ReconciliationException;

    /**
     * @return the currently stored master table
     */
    MasterTable currentTable();
}
