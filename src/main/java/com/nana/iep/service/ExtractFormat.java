package com.nana.iep.service;

import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * ExtractFormat - The versioned convention used to pack session and goal
 * sub-records into one extract column.
 *
 * <p>VERSION 1 LAYOUT (defaults):
 * <pre>
 *   S|2025-01-03|Compass meeting;S|2025-01-10|Compass meeting;G|2025-01-01|reading|active
 *   \_ type|date|value[|status] _/ ; next sub-record ...
 * </pre>
 * <ul>
 *   <li>sub-records separated by {@code recordDelimiter} ({@code ;})</li>
 *   <li>fields separated by {@code fieldDelimiter} ({@code |})</li>
 *   <li>field order given by {@code fieldOrder} ({@code type,date,value,status})</li>
 *   <li>type tag {@code sessionTag} ({@code S}) or {@code goalTag} ({@code G}),
 *       case-insensitive</li>
 *   <li>dates in {@code datePattern} ({@code uuuu-MM-dd}, resolved strictly)</li>
 * </ul>
 *
 * <p>Instances are immutable and validated on construction.
 */
public final class ExtractFormat {

    /** The only packing convention version this build understands. */
    public static final int SUPPORTED_VERSION = 1;

    /** A named position inside a sub-record. */
    public enum Slot { TYPE, DATE, VALUE, STATUS }

    private final int               version;
    private final String            recordDelimiter;
    private final String            fieldDelimiter;
    private final List<Slot>        fieldOrder;
    private final String            sessionTag;
    private final String            goalTag;
    private final String            datePattern;
    private final DateTimeFormatter dateFormatter;
    private final Pattern           recordSplitter;
    private final Pattern           fieldSplitter;

    /**
     * @throws IllegalArgumentException if any part of the convention is invalid
     */
    public ExtractFormat(int version,
                         String recordDelimiter,
                         String fieldDelimiter,
                         List<Slot> fieldOrder,
                         String sessionTag,
                         String goalTag,
                         String datePattern) {
        if (version != SUPPORTED_VERSION) {
            throw new IllegalArgumentException("Unsupported extract format version "
                    + version + "; expected " + SUPPORTED_VERSION + ".");
        }
        if (recordDelimiter == null || recordDelimiter.isEmpty()
                || fieldDelimiter == null || fieldDelimiter.isEmpty()) {
            throw new IllegalArgumentException("Delimiters must not be empty.");
        }
        if (recordDelimiter.equals(fieldDelimiter)) {
            throw new IllegalArgumentException("Record and field delimiters must differ.");
        }
        if (fieldOrder == null || fieldOrder.size() != Slot.values().length
                || !EnumSet.copyOf(fieldOrder).equals(EnumSet.allOf(Slot.class))) {
            throw new IllegalArgumentException("Field order must name each of "
                    + EnumSet.allOf(Slot.class) + " exactly once, got " + fieldOrder + ".");
        }
        if (sessionTag == null || sessionTag.isBlank() || goalTag == null || goalTag.isBlank()
                || sessionTag.trim().equalsIgnoreCase(goalTag.trim())) {
            throw new IllegalArgumentException("Session and goal tags must be non-blank and distinct.");
        }
        this.version         = version;
        this.recordDelimiter = recordDelimiter;
        this.fieldDelimiter  = fieldDelimiter;
        this.fieldOrder      = Collections.unmodifiableList(new ArrayList<>(fieldOrder));
        this.sessionTag      = sessionTag.trim();
        this.goalTag         = goalTag.trim();
        this.datePattern     = datePattern;
        this.dateFormatter   = DateTimeFormatter.ofPattern(datePattern, Locale.ROOT)
                                              .withResolverStyle(ResolverStyle.STRICT);
        this.recordSplitter  = Pattern.compile(Pattern.quote(recordDelimiter));
        this.fieldSplitter   = Pattern.compile(Pattern.quote(fieldDelimiter));
    }

    /** @return the version 1 convention with default delimiters and tags */
    public static ExtractFormat defaults() {
        return new ExtractFormat(SUPPORTED_VERSION, ";", "|",
                List.of(Slot.TYPE, Slot.DATE, Slot.VALUE, Slot.STATUS),
                "S", "G", "uuuu-MM-dd");
    }

    /**
     * Parses a comma-separated slot list such as {@code "type,date,value,status"}.
     *
     * @param slotList the slot list
     * @return the slots in order
     * @throws IllegalArgumentException on an unknown slot name
     */
    public static List<Slot> parseFieldOrder(String slotList) {
        List<Slot> slots = new ArrayList<>();
        if (slotList == null) {
            return slots;
        }
        for (String part : slotList.split(",")) {
            if (part.isBlank()) continue;
            try {
                slots.add(Slot.valueOf(part.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unknown field slot '" + part.trim() + "'.", ex);
            }
        }
        return slots;
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public int getVersion()                   { return version; }

    public String getRecordDelimiter()        { return recordDelimiter; }

    public String getFieldDelimiter()         { return fieldDelimiter; }

    public List<Slot> getFieldOrder()         { return fieldOrder; }

    public String getSessionTag()             { return sessionTag; }

    public String getGoalTag()                { return goalTag; }

    public String getDatePattern()            { return datePattern; }

    public DateTimeFormatter getDateFormatter() { return dateFormatter; }

    // -----------------------------------------------------------------------
    // SPLITTING HELPERS
    // -----------------------------------------------------------------------

    /** Splits a compiled column into sub-records, keeping empty ones. */
    String[] splitRecords(String compiled) {
        return recordSplitter.split(compiled, -1);
    }

    /** Splits one sub-record into fields, keeping empty trailing fields. */
    String[] splitFields(String subRecord) {
        return fieldSplitter.split(subRecord, -1);
    }

    /** @return 0-based index of the slot in a sub-record */
    int indexOf(Slot slot) {
        return fieldOrder.indexOf(slot);
    }

    /** @return true if the status slot is the last field of a sub-record */
    boolean statusIsLast() {
        return indexOf(Slot.STATUS) == fieldOrder.size() - 1;
    }

    @Override
    public String toString() {
        return "ExtractFormat{v" + version
               + ", record='" + recordDelimiter + "'"
               + ", field='" + fieldDelimiter + "'"
               + ", order=" + fieldOrder
               + ", tags=" + sessionTag + "/" + goalTag
               + ", date=" + datePattern + "}";
    }
}
