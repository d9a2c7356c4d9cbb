package com.nana.iep.service;

/**
 * MalformedExtractException - A raw row's packed column does not follow the
 * configured {@link ExtractFormat}.
 *
 * <p>Per-row and recoverable. The {@link Expander} catches it, skips the
 * offending row and records a row error; it never propagates further.
 */
public class MalformedExtractException extends Exception {

    private final int rowNumber;

    /**
     * @param rowNumber 1-based source row number of the offending row
     * @param message   what did not match the expected structure
     */
    public MalformedExtractException(int rowNumber, String message) {
        super(message);
        this.rowNumber = rowNumber;
    }

    /** @return 1-based source row number of the offending row */
    public int getRowNumber() {
        return rowNumber;
    }
}
