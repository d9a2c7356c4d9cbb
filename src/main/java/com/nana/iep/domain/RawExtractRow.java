package com.nana.iep.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * RawExtractRow - One row of a chronicle extract, as decoded by the reader.
 *
 * <p>FIELD OVERVIEW:
 * <pre>
 *   rowNumber      - 1-based row identifier in the source (used in error lists)
 *   studentCode    - the student's display code, trimmed; stable across extracts
 *   compiledField  - the packed column holding session and goal sub-records
 *   passthrough    - every other column, in source column order
 *                    (e.g. Student Name, Gender, Year Level, House)
 * </pre>
 *
 * <p>Instances are immutable; the passthrough map is copied on construction.
 */
public final class RawExtractRow {

    private final int                 rowNumber;
    private final String              studentCode;
    private final String              compiledField;
    private final Map<String, String> passthrough;

    /**
     * @param rowNumber     1-based source row number
     * @param studentCode   the student code; null is stored as ""
     * @param compiledField the packed column; null is stored as ""
     * @param passthrough   identity columns; may be null
     */
    public RawExtractRow(int rowNumber,
                         String studentCode,
                         String compiledField,
                         Map<String, String> passthrough) {
        this.rowNumber     = rowNumber;
        this.studentCode   = studentCode == null ? "" : studentCode.trim();
        this.compiledField = compiledField == null ? "" : compiledField;
        this.passthrough   = passthrough == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(passthrough));
    }

    public int getRowNumber()                  { return rowNumber; }

    public String getStudentCode()             { return studentCode; }

    public String getCompiledField()           { return compiledField; }

    /** @return unmodifiable passthrough identity fields in source order */
    public Map<String, String> getPassthrough() { return passthrough; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawExtractRow)) return false;
        RawExtractRow that = (RawExtractRow) o;
        return rowNumber == that.rowNumber
               && studentCode.equals(that.studentCode)
               && compiledField.equals(that.compiledField)
               && passthrough.equals(that.passthrough);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowNumber, studentCode, compiledField, passthrough);
    }

    @Override
    public String toString() {
        return "RawExtractRow{row=" + rowNumber
               + ", code='" + studentCode + "'"
               + ", compiled='" + compiledField + "'}";
    }
}
