package com.nana.iep.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MasterTable - The cumulative, ordered audit table.
 *
 * <p>Rows are unique by student code and kept in first-seen order; a row's
 * position never changes once assigned. The table is an immutable value:
 * a run reads one table and produces a new one, and the caller decides
 * whether to persist it.
 */
public final class MasterTable {

    private static final MasterTable EMPTY = new MasterTable(Collections.emptyList());

    private final List<MasterRow>      rows;
    private final Map<String, Integer> positionByCode;

    private MasterTable(List<MasterRow> rows) {
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < this.rows.size(); i++) {
            MasterRow row = Objects.requireNonNull(this.rows.get(i), "row " + i);
            Integer previous = index.putIfAbsent(row.getStudentCode(), i);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate student code '"
                        + row.getStudentCode() + "' at positions "
                        + previous + " and " + i + ".");
            }
        }
        this.positionByCode = Collections.unmodifiableMap(index);
    }

    /** @return the empty table used on the first run */
    public static MasterTable empty() {
        return EMPTY;
    }

    /**
     * Creates a table from rows in their stored order.
     *
     * @param rows the rows; must not be null and must have unique codes
     * @return the table
     * @throws IllegalArgumentException on a duplicate student code
     */
    public static MasterTable of(List<MasterRow> rows) {
        return rows.isEmpty() ? EMPTY : new MasterTable(rows);
    }

    /** @return unmodifiable rows in first-seen order */
    public List<MasterRow> getRows() { return rows; }

    public int size() { return rows.size(); }

    public boolean isEmpty() { return rows.isEmpty(); }

    public boolean contains(String studentCode) {
        return positionByCode.containsKey(studentCode);
    }

    /**
     * @param studentCode the code to look up
     * @return the 0-based position, or -1 if the code is absent
     */
    public int positionOf(String studentCode) {
        Integer pos = positionByCode.get(studentCode);
        return pos == null ? -1 : pos;
    }

    public Optional<MasterRow> find(String studentCode) {
        int pos = positionOf(studentCode);
        return pos < 0 ? Optional.empty() : Optional.of(rows.get(pos));
    }

    /**
     * Returns the rows ordered for a per-run listing: session count
     * descending, then student name, then code. The table itself is not
     * reordered.
     *
     * @return a new list in ranked order
     */
    public List<MasterRow> rankedBySessionCount() {
        List<MasterRow> ranked = new ArrayList<>(rows);
        ranked.sort(Comparator
                .comparingInt((MasterRow r) -> r.getSummary().getSessionCount()).reversed()
                .thenComparing(MasterRow::getStudentName)
                .thenComparing(MasterRow::getStudentCode));
        return ranked;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MasterTable)) return false;
        return rows.equals(((MasterTable) o).rows);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public String toString() {
        return "MasterTable{rows=" + rows.size() + "}";
    }
}
