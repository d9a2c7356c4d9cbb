package com.nana.iep.repository;

import com.nana.iep.domain.MasterTable;

/**
 * MasterTableRepository - Persistence contract for the audit master table.
 *
 * <p>The master table is loaded whole at the start of a run and saved whole
 * at the end. Besides the visible columns, an implementation must persist
 * each row's retained facts (session fact identities and goal
 * observations): the next run deduplicates against them.
 *
 * <p>EXCEPTION CONTRACT:
 * Storage failures are reported as the unchecked {@link RepositoryException}.
 * {@link #save(MasterTable)} is atomic: either the whole table is stored or
 * the previously stored table is left intact.
 */
public interface MasterTableRepository {

    /**
     * Loads the stored table in row order.
     *
     * @return the stored table, or {@link MasterTable#empty()} on first run
     * @throws RepositoryException if the store cannot be read
     */
    MasterTable load();

    /**
     * Replaces the stored table with {@code table} in one transaction.
     *
     * @param table the table to store; must not be null
     * @throws RepositoryException if the store cannot be written; the
     *         previously stored table is unchanged
     */
    void save(MasterTable table);

    /**
     * @return number of stored rows
     * @throws RepositoryException if the store cannot be read
     */
    int countRows();

    // -----------------------------------------------------------------------
    // NESTED EXCEPTION
    // -----------------------------------------------------------------------

    /**
     * RepositoryException - Unchecked wrapper for storage failures.
     */
    class RepositoryException extends RuntimeException {

        public RepositoryException(String message, Throwable cause) {
            super(message, cause);
        }

        public RepositoryException(String message) {
            super(message);
        }
    }
}
