package com.nana.iep.service;

import com.nana.iep.domain.FactType;
import com.nana.iep.domain.GoalStatus;
import com.nana.iep.domain.NormalizedRecord;
import com.nana.iep.domain.RawExtractRow;
import com.nana.iep.service.ChangeSummary.RowError;
import com.nana.iep.service.ExtractFormat.Slot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ExpanderTest {

    private final Expander expander = new Expander(ExtractFormat.defaults());

    private static RawExtractRow row(int n, String code, String compiled) {
        return new RawExtractRow(n, code, compiled, Map.of("Student Name", "Name " + code));
    }

    @Nested
    @DisplayName("Well-formed rows")
    class WellFormed {

        @Test
        @DisplayName("sessions and goals are expanded in sub-record order")
        void expandsMixedRow() throws Exception {
            List<NormalizedRecord> facts = expander.expandRow(row(2, "S1",
                    "S|2025-01-01|Maths;G|2025-01-02|Reading|active;S|2025-01-03|Maths|"));

            assertEquals(3, facts.size());
            assertEquals(FactType.SESSION, facts.get(0).getFactType());
            assertEquals(LocalDate.of(2025, 1, 1), facts.get(0).getFactDate());
            assertEquals("Maths", facts.get(0).getFactValue());

            NormalizedRecord goal = facts.get(1);
            assertEquals(FactType.GOAL, goal.getFactType());
            assertEquals("reading", goal.getFactValue());
            assertEquals(GoalStatus.ACTIVE, goal.getGoalStatus());
            assertEquals(FactType.SESSION, facts.get(2).getFactType());
        }

        @Test
        @DisplayName("blank sub-records and whitespace around them are ignored")
        void blankSubRecordsIgnored() throws Exception {
            List<NormalizedRecord> facts = expander.expandRow(row(2, "S1",
                    " S|2025-01-01|Maths ;; ;"));
            assertEquals(1, facts.size());
        }

        @Test
        @DisplayName("an empty compiled field yields no facts and no error")
        void emptyCompiledField() throws Exception {
            assertTrue(expander.expandRow(row(2, "S1", "  ")).isEmpty());
        }

        @Test
        @DisplayName("a reordered field layout is honoured")
        void customFieldOrder() throws Exception {
            ExtractFormat format = new ExtractFormat(1, "#", "/",
                    List.of(Slot.TYPE, Slot.VALUE, Slot.STATUS, Slot.DATE), "SES", "GOAL", "dd.MM.uuuu");
            List<NormalizedRecord> facts = new Expander(format).expandRow(row(2, "S1",
                    "SES/Art//05.03.2025#GOAL/Numeracy/green/06.03.2025"));

            assertEquals(2, facts.size());
            assertEquals(LocalDate.of(2025, 3, 5), facts.get(0).getFactDate());
            assertEquals(GoalStatus.MET, facts.get(1).getGoalStatus());
        }
    }

    @Nested
    @DisplayName("Malformed rows")
    class Malformed {

        @ParameterizedTest
        @ValueSource(strings = {
                "X|2025-01-01|Maths",
                "S|2025-13-01|Maths",
                "S|2025-02-30|Maths",
                "S|2025-02-28|Maths;S|2025-02-30|Maths",
                "S|2025-01-01",
                "S|2025-01-01|  ",
                "S|2025-01-01|Maths|met",
                "G|2025-01-01|Reading",
                "G|2025-01-01|Reading|sideways",
                "G|2025-01-01|Reading|met|extra",
                "S|2025-01-01|Maths;G|bad-date|Reading|met"
        })
        @DisplayName("any malformed sub-record rejects the whole row")
        void malformedRowThrows(String compiled) {
            MalformedExtractException ex = assertThrows(MalformedExtractException.class,
                    () -> expander.expandRow(row(7, "S1", compiled)));
            assertEquals(7, ex.getRowNumber());
        }

        @Test
        @DisplayName("a blank student code rejects the row")
        void blankCodeThrows() {
            assertThrows(MalformedExtractException.class,
                    () -> expander.expandRow(row(3, "  ", "S|2025-01-01|Maths")));
        }

        @Test
        @DisplayName("the message names the failing sub-record")
        void messageNamesSubRecord() {
            MalformedExtractException ex = assertThrows(MalformedExtractException.class,
                    () -> expander.expandRow(row(3, "S1", "S|2025-01-01|Maths;Q|2025-01-01|x")));
            assertTrue(ex.getMessage().contains("sub-record 2"), ex.getMessage());
        }
    }

    @Nested
    @DisplayName("Batch expansion")
    class Batch {

        @Test
        @DisplayName("expand collects errors, keeps good rows, captures identities of accepted rows")
        void expandCollectsErrors() {
            List<RawExtractRow> rows = List.of(
                    row(2, "S1", "S|2025-01-01|Maths"),
                    row(3, "S2", "S|nope|Maths"),
                    row(4, "S3", "G|2025-01-01|Numeracy|yellow"));

            ExpansionResult result = expander.expand(rows);

            assertEquals(2, result.getRecords().size());
            assertEquals(1, result.getRowsRejected());
            assertEquals(3, result.getRowsRead());
            RowError error = result.getErrors().get(0);
            assertEquals(3, error.getRowNumber());
            assertEquals("S2", error.getStudentCode());
            assertEquals(RowError.Kind.MALFORMED_EXTRACT, error.getKind());
            assertEquals(List.of("S1", "S3"), new ArrayList<>(result.getIdentities().keySet()));
            assertEquals("Name S1", result.getIdentities().get("S1").get("Student Name"));
        }

        @Test
        @DisplayName("expand does not modify the input rows")
        void inputUntouched() {
            RawExtractRow original = row(2, "S1", "S|2025-01-01|Maths");
            RawExtractRow copy     = row(2, "S1", "S|2025-01-01|Maths");
            expander.expand(List.of(original));
            assertEquals(copy, original);
        }

        @Test
        @DisplayName("stream is lazy and reports rejected rows to the sink when consumed")
        void streamIsLazy() {
            List<RowError> errors = new ArrayList<>();
            Stream<NormalizedRecord> stream = expander.stream(List.of(
                    row(2, "S1", "S|2025-01-01|Maths"),
                    row(3, "S2", "S|bad|Maths")), errors::add);

            assertTrue(errors.isEmpty());
            List<String> codes = stream.map(NormalizedRecord::getStudentCode).collect(Collectors.toList());
            assertEquals(List.of("S1"), codes);
            assertEquals(1, errors.size());
        }
    }
}
