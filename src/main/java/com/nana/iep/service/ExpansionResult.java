package com.nana.iep.service;

import com.nana.iep.domain.NormalizedRecord;
import com.nana.iep.service.ChangeSummary.RowError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ExpansionResult - Everything the {@link Expander} recovered from one batch.
 *
 * <ul>
 *   <li>{@code records} - atomic facts of every accepted row, in row order</li>
 *   <li>{@code errors} - one entry per rejected row</li>
 *   <li>{@code identities} - passthrough fields per student code, later
 *       rows overlaying earlier ones, accepted rows only</li>
 * </ul>
 */
public final class ExpansionResult {

    private final List<NormalizedRecord>           records;
    private final List<RowError>                   errors;
    private final Map<String, Map<String, String>> identities;
    private final int                              rowsRead;

    ExpansionResult(List<NormalizedRecord> records,
                    List<RowError> errors,
                    Map<String, Map<String, String>> identities,
                    int rowsRead) {
        this.records    = List.copyOf(records);
        this.errors     = List.copyOf(errors);
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        identities.forEach((code, fields) ->
                copy.put(code, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
        this.identities = Collections.unmodifiableMap(copy);
        this.rowsRead   = rowsRead;
    }

    public List<NormalizedRecord> getRecords()                { return records; }

    public List<RowError> getErrors()                         { return errors; }

    public Map<String, Map<String, String>> getIdentities()   { return identities; }

    public int getRowsRead()                                  { return rowsRead; }

    public int getRowsRejected()                              { return errors.size(); }

    @Override
    public String toString() {
        return "ExpansionResult{rows=" + rowsRead
               + ", records=" + records.size()
               + ", rejected=" + errors.size()
               + ", students=" + identities.size() + "}";
    }
}
