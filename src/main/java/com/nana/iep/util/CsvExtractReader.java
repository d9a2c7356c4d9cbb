package com.nana.iep.util;

import com.nana.iep.domain.RawExtractRow;
import com.nana.iep.service.ChangeSummary.RowError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CsvExtractReader - Decodes the student information system's CSV extract
 * into {@link RawExtractRow}s.
 *
 * <p>Tolerated input:
 * <ul>
 *   <li>UTF-8 BOM at the start of the file</li>
 *   <li>{@code #} comment lines and blank lines</li>
 *   <li>quoted fields containing commas, escaped quotes or line breaks</li>
 *   <li>columns in any order; header names match case-insensitively</li>
 * </ul>
 *
 * <p>The header must name the student code column and the packed column.
 * Every other column is carried through as an identity field. A row whose
 * cells cannot be parsed becomes a {@link RowError.Kind#PARSE_ERROR}; the
 * rest of the file is still read.
 */
public class CsvExtractReader {

    private static final Logger log = LoggerFactory.getLogger(CsvExtractReader.class);

    private final String codeColumn;
    private final String compiledColumn;

    /**
     * @param codeColumn     header of the student code column
     * @param compiledColumn header of the packed facts column
     */
    public CsvExtractReader(String codeColumn, String compiledColumn) {
        if (codeColumn == null || codeColumn.isBlank()
                || compiledColumn == null || compiledColumn.isBlank()) {
            throw new IllegalArgumentException("Code and compiled column names must not be blank.");
        }
        if (codeColumn.trim().equalsIgnoreCase(compiledColumn.trim())) {
            throw new IllegalArgumentException("Code and compiled columns must differ.");
        }
        this.codeColumn     = codeColumn.trim();
        this.compiledColumn = compiledColumn.trim();
    }

    public static CsvExtractReader fromConfig(AuditConfig config) {
        return new CsvExtractReader(config.getCodeColumn(), config.getCompiledColumn());
    }

    // -----------------------------------------------------------------------
    // PUBLIC API
    // -----------------------------------------------------------------------

    /**
     * Reads the whole extract.
     *
     * @param csvFile the extract file
     * @return decoded rows and per-row parse errors
     * @throws IOException if the file cannot be read or has no usable header
     */
    public ExtractReadResult read(Path csvFile) throws IOException {
        log.info("Reading extract '{}'.", csvFile);
        AppLogger.setOperationContext("READ_EXTRACT");
        try {
            validateFile(csvFile);
            List<SourceRecord> records = readRecords(csvFile);

            int headerIndex = findHeaderIndex(records);
            if (headerIndex < 0) {
                throw new IOException("No header row naming '" + codeColumn + "' and '"
                        + compiledColumn + "' found in " + csvFile.getFileName() + ".");
            }
            List<String> headers = parseCsvRow(records.get(headerIndex).text);
            int codeIndex     = indexOfHeader(headers, codeColumn);
            int compiledIndex = indexOfHeader(headers, compiledColumn);

            List<RawExtractRow> rows   = new ArrayList<>();
            List<RowError>      errors = new ArrayList<>();

            for (int i = headerIndex + 1; i < records.size(); i++) {
                SourceRecord record = records.get(i);
                if (record.text.isBlank() || record.text.startsWith("#")) {
                    continue;
                }
                if (record.unterminated) {
                    errors.add(parseError(record.lineNumber,
                            "Unclosed quoted field at end of file."));
                    continue;
                }

                List<String> cells;
                try {
                    cells = parseCsvRow(record.text);
                } catch (IllegalArgumentException ex) {
                    errors.add(parseError(record.lineNumber, ex.getMessage()));
                    continue;
                }
                if (cells.size() > headers.size()) {
                    errors.add(parseError(record.lineNumber, "Expected at most "
                            + headers.size() + " columns, found " + cells.size() + "."));
                    continue;
                }

                Map<String, String> passthrough = new LinkedHashMap<>();
                for (int c = 0; c < headers.size(); c++) {
                    if (c != codeIndex && c != compiledIndex) {
                        passthrough.put(headers.get(c).trim(), cell(cells, c));
                    }
                }
                rows.add(new RawExtractRow(record.lineNumber,
                        cell(cells, codeIndex), cell(cells, compiledIndex), passthrough));
            }

            log.info("Read {} extract rows, {} parse error(s).", rows.size(), errors.size());
            if (!errors.isEmpty()) {
                AppLogger.logWarningEvent("EXTRACT_PARSE_ERRORS",
                        "file=" + csvFile.getFileName() + ", errors=" + errors.size());
            }
            return new ExtractReadResult(rows, errors);

        } catch (IOException ex) {
            AppLogger.logErrorEvent("EXTRACT_READ_FAILED", "file=" + csvFile, ex);
            throw ex;
        } finally {
            AppLogger.clearOperationContext();
        }
    }

    /**
     * Parses one CSV record into cells using RFC 4180 quoting.
     *
     * @param line the record text; may contain line breaks inside quotes
     * @return the cell values with quotes removed
     * @throws IllegalArgumentException on an unclosed quote or stray
     *         characters after a closing quote
     */
    public List<String> parseCsvRow(String line) {
        List<String> fields = new ArrayList<>();
        if (line == null || line.isEmpty()) {
            return fields;
        }

        StringBuilder current = new StringBuilder();
        boolean inQuotes    = false;
        boolean afterQuoted = false;
        int length = line.length();

        for (int i = 0; i < length; i++) {
            char c = line.charAt(i);

            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < length && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        inQuotes    = false;
                        afterQuoted = true;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
                afterQuoted = false;
            } else if (afterQuoted) {
                throw new IllegalArgumentException(
                        "Unexpected character after closing quote at position " + (i + 1) + ".");
            } else if (c == '"' && current.length() == 0) {
                inQuotes = true;
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());

        if (inQuotes) {
            throw new IllegalArgumentException("Unclosed quoted field.");
        }
        return fields;
    }

    // -----------------------------------------------------------------------
    // PRIVATE - FILE HANDLING
    // -----------------------------------------------------------------------

    private void validateFile(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("File does not exist: " + path.toAbsolutePath());
        }
        if (!Files.isRegularFile(path)) {
            throw new IOException("Path is not a regular file: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new IOException("File is not readable (check permissions): " + path);
        }
    }

    /**
     * Reads physical lines and joins those belonging to one quoted cell.
     * Each record keeps the 1-based line number it started on.
     */
    private List<SourceRecord> readRecords(Path path) throws IOException {
        List<SourceRecord> records = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            StringBuilder pending = null;
            int pendingStart = 0;

            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1 && line.startsWith("\uFEFF")) {
                    line = line.substring(1);
                    log.debug("UTF-8 BOM detected and stripped.");
                }
                if (pending != null) {
                    pending.append('\n').append(line);
                    if (quotesBalanced(pending)) {
                        records.add(new SourceRecord(pendingStart, pending.toString(), false));
                        pending = null;
                    }
                    continue;
                }
                if (!line.startsWith("#") && !quotesBalanced(line)) {
                    pending = new StringBuilder(line);
                    pendingStart = lineNumber;
                    continue;
                }
                records.add(new SourceRecord(lineNumber, line, false));
            }
            if (pending != null) {
                records.add(new SourceRecord(pendingStart, pending.toString(), true));
            }
        }
        return records;
    }

    /**
     * Tracks quote state the way {@link #parseCsvRow(String)} does: only a
     * quote at the start of a cell opens a quoted cell, so a literal quote
     * inside an unquoted cell never pulls in the following lines.
     *
     * @return true if the text does not end inside a quoted cell
     */
    private static boolean quotesBalanced(CharSequence text) {
        boolean inQuotes  = false;
        boolean cellStart = true;
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < length && text.charAt(i + 1) == '"') {
                        i++;
                    } else {
                        inQuotes = false;
                    }
                }
            } else if (c == ',') {
                cellStart = true;
            } else {
                if (c == '"' && cellStart) {
                    inQuotes = true;
                }
                cellStart = false;
            }
        }
        return !inQuotes;
    }

    // -----------------------------------------------------------------------
    // PRIVATE - HEADER DETECTION
    // -----------------------------------------------------------------------

    /** @return index of the first non-comment record, if it names both required columns */
    private int findHeaderIndex(List<SourceRecord> records) {
        for (int i = 0; i < records.size(); i++) {
            String text = records.get(i).text;
            if (text.isBlank() || text.startsWith("#")) {
                continue;
            }
            List<String> fields;
            try {
                fields = parseCsvRow(text);
            } catch (IllegalArgumentException ex) {
                log.debug("Header candidate at line {} is not valid CSV: {}",
                        records.get(i).lineNumber, ex.getMessage());
                return -1;
            }
            if (indexOfHeader(fields, codeColumn) >= 0
                    && indexOfHeader(fields, compiledColumn) >= 0) {
                log.debug("Header row found at line {}.", records.get(i).lineNumber);
                return i;
            }
            return -1;
        }
        return -1;
    }

    private static int indexOfHeader(List<String> headers, String name) {
        String wanted = name.toLowerCase(Locale.ROOT);
        for (int i = 0; i < headers.size(); i++) {
            if (headers.get(i).trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                return i;
            }
        }
        return -1;
    }

    // -----------------------------------------------------------------------
    // PRIVATE - HELPERS
    // -----------------------------------------------------------------------

    private static String cell(List<String> cells, int index) {
        return index < cells.size() ? cells.get(index) : "";
    }

    private static RowError parseError(int lineNumber, String message) {
        log.warn("Extract line {} could not be parsed: {}", lineNumber, message);
        return new RowError(lineNumber, "", RowError.Kind.PARSE_ERROR, message);
    }

    private static final class SourceRecord {
        final int     lineNumber;
        final String  text;
        final boolean unterminated;

        SourceRecord(int lineNumber, String text, boolean unterminated) {
            this.lineNumber   = lineNumber;
            this.text         = text;
            this.unterminated = unterminated;
        }
    }

    // -----------------------------------------------------------------------
    // RESULT
    // -----------------------------------------------------------------------

    /**
     * ExtractReadResult - Decoded rows plus the rows that could not be decoded.
     */
    public static final class ExtractReadResult {

        private final List<RawExtractRow> rows;
        private final List<RowError>      errors;

        public ExtractReadResult(List<RawExtractRow> rows, List<RowError> errors) {
            this.rows   = Collections.unmodifiableList(new ArrayList<>(rows));
            this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        }

        public List<RawExtractRow> getRows() { return rows; }

        public List<RowError> getErrors()    { return errors; }
    }
}
