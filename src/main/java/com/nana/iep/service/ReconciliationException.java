package com.nana.iep.service;

/**
 * ReconciliationException - Structural invariant violation detected while
 * merging a batch into the master table.
 *
 * <p>Fatal for the run: the reconciler throws before producing any table,
 * and callers must not persist anything. Examples are an incoming batch
 * with a blank student code, or with a summary filed under a key that is
 * not its own student code.
 */
public class ReconciliationException extends Exception {

    /** Student code involved in the violation; empty when not applicable. */
    private final String studentCode;

    public ReconciliationException(String studentCode, String message) {
        super(message);
        this.studentCode = studentCode == null ? "" : studentCode;
    }

    /** @return the student code involved, or "" */
    public String getStudentCode() {
        return studentCode;
    }
}
