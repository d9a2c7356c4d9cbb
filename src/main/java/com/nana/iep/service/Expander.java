package com.nana.iep.service;

import com.nana.iep.domain.GoalStatus;
import com.nana.iep.domain.NormalizedRecord;
import com.nana.iep.domain.RawExtractRow;
import com.nana.iep.service.ChangeSummary.RowError;
import com.nana.iep.service.ExtractFormat.Slot;
import com.nana.iep.util.AppLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Expander - Unpacks the compiled extract column into atomic facts.
 *
 * <p>Each {@link RawExtractRow} carries one packed column holding any number
 * of session and goal sub-records laid out as described by the configured
 * {@link ExtractFormat}. This class turns those rows into
 * {@link NormalizedRecord}s.
 *
 * <p>PARTIAL FAILURE:
 * A row is expanded all-or-nothing. If any of its sub-records is malformed
 * the whole row is dropped and a {@link RowError} is recorded; the other
 * rows of the batch are unaffected. {@link MalformedExtractException} never
 * escapes this class.
 *
 * <p>Input rows are never modified.
 */
public class Expander {

    private static final Logger log = LoggerFactory.getLogger(Expander.class);

    private final ExtractFormat format;

    /**
     * @param format the packing convention; must not be null
     */
    public Expander(ExtractFormat format) {
        this.format = Objects.requireNonNull(format, "format");
        log.debug("Expander instantiated with {}.", format);
    }

    // -----------------------------------------------------------------------
    // PUBLIC API
    // -----------------------------------------------------------------------

    /**
     * Lazily expands a batch. Nothing is parsed until the stream is consumed;
     * each call starts a fresh pass over the batch.
     *
     * @param rows      the batch; must not be null
     * @param errorSink receives one {@link RowError} per rejected row
     * @return a one-pass stream of facts in row order
     */
    public Stream<NormalizedRecord> stream(List<RawExtractRow> rows, Consumer<RowError> errorSink) {
        return rows.stream().flatMap(row -> {
            try {
                return expandRow(row).stream();
            } catch (MalformedExtractException ex) {
                errorSink.accept(reject(row, ex));
                return Stream.empty();
            }
        });
    }

    /**
     * Eagerly expands a batch and captures passthrough identity fields of
     * every accepted row.
     *
     * @param rows the batch; must not be null
     * @return records, row errors and identities
     */
    public ExpansionResult expand(List<RawExtractRow> rows) {
        List<NormalizedRecord>           records    = new ArrayList<>();
        List<RowError>                   errors     = new ArrayList<>();
        Map<String, Map<String, String>> identities = new LinkedHashMap<>();

        for (RawExtractRow row : rows) {
            try {
                records.addAll(expandRow(row));
            } catch (MalformedExtractException ex) {
                errors.add(reject(row, ex));
                continue;
            }
            Map<String, String> identity =
                    identities.computeIfAbsent(row.getStudentCode(), k -> new LinkedHashMap<>());
            row.getPassthrough().forEach((field, value) -> {
                if (value != null && !value.isBlank()) {
                    identity.put(field, value.trim());
                }
            });
        }

        ExpansionResult result = new ExpansionResult(records, errors, identities, rows.size());
        log.info("Expanded {} rows into {} facts; {} rows rejected.",
                rows.size(), records.size(), errors.size());
        return result;
    }

    /**
     * Expands a single row.
     *
     * @param row the row to expand
     * @return the row's facts in sub-record order; empty for a blank column
     * @throws MalformedExtractException if the student code is blank or any
     *         sub-record does not follow the format
     */
    public List<NormalizedRecord> expandRow(RawExtractRow row) throws MalformedExtractException {
        if (row.getStudentCode().isEmpty()) {
            throw new MalformedExtractException(row.getRowNumber(), "student code is blank");
        }
        List<NormalizedRecord> facts = new ArrayList<>();
        String compiled = row.getCompiledField();
        if (compiled.isBlank()) {
            log.debug("Row {} ({}) has an empty compiled field.", row.getRowNumber(), row.getStudentCode());
            return facts;
        }

        String[] subRecords = format.splitRecords(compiled);
        for (int i = 0; i < subRecords.length; i++) {
            String sub = subRecords[i];
            if (sub.isBlank()) {
                continue;
            }
            facts.add(parseSubRecord(row, sub.trim(), i + 1));
        }
        return facts;
    }

    // -----------------------------------------------------------------------
    // PRIVATE - SUB-RECORD PARSING
    // -----------------------------------------------------------------------

    private NormalizedRecord parseSubRecord(RawExtractRow row, String sub, int index)
            throws MalformedExtractException {
        String[] fields = format.splitFields(sub);
        int slots = format.getFieldOrder().size();

        int typeIdx = format.indexOf(Slot.TYPE);
        if (typeIdx >= fields.length) {
            throw malformed(row, index, "missing type tag in '" + sub + "'");
        }
        String tag = fields[typeIdx].trim();
        boolean session = tag.equalsIgnoreCase(format.getSessionTag());
        boolean goal    = tag.equalsIgnoreCase(format.getGoalTag());
        if (!session && !goal) {
            throw malformed(row, index, "unknown tag '" + tag + "'");
        }

        boolean shortSession = session && format.statusIsLast() && fields.length == slots - 1;
        if (fields.length != slots && !shortSession) {
            throw malformed(row, index, "expected " + slots + " fields but found "
                    + fields.length + " in '" + sub + "'");
        }

        LocalDate date  = parseDate(row, index, field(fields, Slot.DATE));
        String    value = field(fields, Slot.VALUE).trim();
        if (value.isEmpty()) {
            throw malformed(row, index, (session ? "session label" : "goal category") + " is blank");
        }

        String statusToken = field(fields, Slot.STATUS).trim();
        if (session) {
            if (!statusToken.isEmpty()) {
                throw malformed(row, index, "session carries a status '" + statusToken + "'");
            }
            return NormalizedRecord.session(row.getStudentCode(), value, date);
        }

        GoalStatus status = GoalStatus.fromToken(statusToken)
                .orElseThrow(() -> malformed(row, index, "unknown goal status '" + statusToken + "'"));
        return NormalizedRecord.goal(row.getStudentCode(),
                value.toLowerCase(Locale.ROOT), status, date);
    }

    /** Returns the field for a slot, or "" when a short session omits it. */
    private String field(String[] fields, Slot slot) {
        int idx = format.indexOf(slot);
        return idx < fields.length ? fields[idx] : "";
    }

    private LocalDate parseDate(RawExtractRow row, int index, String raw)
            throws MalformedExtractException {
        String trimmed = raw.trim();
        try {
            return LocalDate.parse(trimmed, format.getDateFormatter());
        } catch (DateTimeParseException ex) {
            throw malformed(row, index, "date '" + trimmed + "' does not match "
                    + format.getDatePattern());
        }
    }

    private MalformedExtractException malformed(RawExtractRow row, int index, String detail) {
        return new MalformedExtractException(row.getRowNumber(), "sub-record " + index + ": " + detail);
    }

    private RowError reject(RawExtractRow row, MalformedExtractException ex) {
        log.warn("Rejected extract row {} ({}): {}", row.getRowNumber(), row.getStudentCode(), ex.getMessage());
        AppLogger.logWarningEvent("EXTRACT_ROW_REJECTED",
                "row=" + row.getRowNumber() + ", code=" + row.getStudentCode());
        return new RowError(ex.getRowNumber(), row.getStudentCode(),
                RowError.Kind.MALFORMED_EXTRACT, ex.getMessage());
    }
}
