package com.nana.iep.service;

import com.nana.iep.domain.GoalStatus;
import com.nana.iep.domain.MasterRow;
import com.nana.iep.domain.MasterTable;
import com.nana.iep.domain.RawExtractRow;
import com.nana.iep.domain.StudentSummary;
import com.nana.iep.service.ChangeSummary.RowError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * End-to-end behaviour of expand, aggregate and reconcile on in-memory tables.
 */
@ExtendWith(MockitoExtension.class)
class AuditPipelineTest {

    private static final String WEEK_1 =
            "S|2025-01-01|Maths;S|2025-01-02|Maths;S|2025-01-03|Reading;G|2025-01-01|reading|active";

    private static final String WEEK_2 = WEEK_1
            + ";S|2025-02-01|Maths;G|2025-02-01|reading|met";

    @Spy
    private Aggregator aggregator = new Aggregator();

    private final AuditPipeline pipeline =
            new AuditPipeline(ExtractFormat.defaults(), ReconcilePolicy.defaults());

    private static RawExtractRow row(int n, String code, String compiled) {
        return new RawExtractRow(n, code, compiled, Map.of("Student Name", "Name " + code));
    }

    @Nested
    @DisplayName("Weekly scenarios")
    class Scenarios {

        @Test
        @DisplayName("first extract into an empty table appends one row")
        void firstRunAppends() throws Exception {
            ReconciliationResult result = pipeline.run(List.of(row(2, "S1", WEEK_1)), MasterTable.empty());

            MasterTable table = result.getMasterTable();
            assertEquals(1, table.size());
            MasterRow s1 = table.getRows().get(0);
            assertEquals(3, s1.getSummary().getSessionCount());
            assertEquals(Map.of("reading", GoalStatus.ACTIVE), s1.getSummary().getGoalStatus());
            assertEquals(1, result.getChangeSummary().getAppended());
            assertEquals("Name S1", s1.getStudentName());
        }

        @Test
        @DisplayName("cumulative re-send adds only new sessions and moves the goal forward")
        void secondRunUpdates() throws Exception {
            MasterTable afterWeek1 = pipeline.run(List.of(row(2, "S1", WEEK_1)), MasterTable.empty())
                    .getMasterTable();

            ReconciliationResult result = pipeline.run(List.of(row(2, "S1", WEEK_2)), afterWeek1);

            MasterRow s1 = result.getMasterTable().getRows().get(0);
            assertEquals(4, s1.getSummary().getSessionCount());
            assertEquals(GoalStatus.MET, s1.getSummary().getGoalStatus().get("reading"));
            assertEquals(1, result.getChangeSummary().getUpdated());
            assertEquals(0, result.getChangeSummary().getAppended());
        }

        @Test
        @DisplayName("a malformed row is reported and the rest of the batch is processed")
        void malformedRowExcluded() throws Exception {
            ReconciliationResult result = pipeline.run(List.of(
                    row(2, "S1", WEEK_1),
                    row(3, "S2", "S|2025-01-01|Maths;Z|oops"),
                    row(4, "S3", "S|2025-01-05|Art")), MasterTable.empty());

            assertEquals(List.of("S1", "S3"), result.getMasterTable().getRows().stream()
                    .map(MasterRow::getStudentCode).toList());
            List<RowError> errors = result.getChangeSummary().getErrors();
            assertEquals(1, errors.size());
            assertEquals(3, errors.get(0).getRowNumber());
            assertFalse(result.getMasterTable().contains("S2"));
        }
    }

    @Nested
    @DisplayName("Invariants")
    class Invariants {

        @Test
        @DisplayName("running the same extract twice changes nothing the second time")
        void idempotent() throws Exception {
            List<RawExtractRow> batch = List.of(row(2, "S1", WEEK_1), row(3, "S2", "S|2025-01-04|Art"));
            MasterTable once  = pipeline.run(batch, MasterTable.empty()).getMasterTable();
            ReconciliationResult twice = pipeline.run(batch, once);

            assertEquals(once, twice.getMasterTable());
            assertFalse(twice.getChangeSummary().hasChanges());
            assertEquals(2, twice.getChangeSummary().getUnchanged());
        }

        @Test
        @DisplayName("overlapping extracts never double-count a session")
        void noDoubleCounting() throws Exception {
            MasterTable table = MasterTable.empty();
            for (int week = 0; week < 4; week++) {
                table = pipeline.run(List.of(row(2, "S1", WEEK_2)), table).getMasterTable();
            }
            assertEquals(4, table.find("S1").get().getSummary().getSessionCount());
        }

        @Test
        @DisplayName("an older extract run after a newer one never regresses a goal")
        void olderExtractKeepsNewerGoal() throws Exception {
            MasterTable afterWeek2 = pipeline.run(List.of(row(2, "S1", WEEK_2)), MasterTable.empty())
                    .getMasterTable();

            ReconciliationResult result = pipeline.run(List.of(row(2, "S1", WEEK_1)), afterWeek2);

            MasterRow s1 = result.getMasterTable().getRows().get(0);
            assertEquals(GoalStatus.MET, s1.getSummary().getGoalStatus().get("reading"));
            assertEquals(4, s1.getSummary().getSessionCount());
            assertEquals(1, result.getChangeSummary().getUnchanged());
            assertFalse(result.getChangeSummary().hasChanges());
            assertSame(afterWeek2.getRows().get(0), s1);
        }

        @Test
        @DisplayName("row order is preserved and the table only grows")
        void orderPreservedAppendOnly() throws Exception {
            MasterTable first = pipeline.run(List.of(
                    row(2, "S1", "S|2025-01-01|Maths"),
                    row(3, "S2", "S|2025-01-01|Maths")), MasterTable.empty()).getMasterTable();

            MasterTable second = pipeline.run(List.of(
                    row(2, "S3", "S|2025-01-08|Maths"),
                    row(3, "S2", "S|2025-01-08|Maths")), first).getMasterTable();

            assertEquals(List.of("S1", "S2", "S3"), second.getRows().stream()
                    .map(MasterRow::getStudentCode).toList());
            assertTrue(second.size() >= first.size());
        }

        @Test
        @DisplayName("the same student split across several rows is merged into one")
        void studentAcrossRows() throws Exception {
            ReconciliationResult result = pipeline.run(List.of(
                    row(2, "S1", "S|2025-01-01|Maths"),
                    row(3, "S1", "S|2025-01-02|Maths;S|2025-01-01|Maths")), MasterTable.empty());
            assertEquals(1, result.getMasterTable().size());
            assertEquals(2, result.getMasterTable().getRows().get(0).getSummary().getSessionCount());
        }
    }

    @Nested
    @DisplayName("Empty batches")
    class EmptyBatches {

        @Test
        @DisplayName("a batch with no usable facts returns the master unchanged without aggregating")
        void noFactsSkipsAggregation() throws Exception {
            AuditPipeline spied = new AuditPipeline(new Expander(ExtractFormat.defaults()), aggregator,
                    new Reconciler(ReconcilePolicy.defaults()));
            MasterTable master = MasterTable.of(List.of(
                    new MasterRow(null, new StudentSummary.Builder("S1").build())));

            ReconciliationResult result = spied.run(List.of(row(2, "S2", "X|bad")), master);

            assertSame(master, result.getMasterTable());
            assertEquals(1, result.getChangeSummary().getErrorCount());
            verify(aggregator, never()).aggregate(any());
        }

        @Test
        @DisplayName("read errors come before expansion errors")
        void readErrorsFirst() throws Exception {
            RowError readError = new RowError(5, "", RowError.Kind.PARSE_ERROR, "unclosed quote");
            ReconciliationResult result = pipeline.run(List.of(row(2, "S2", "X|bad")),
                    MasterTable.empty(), List.of(readError));

            List<RowError> errors = result.getChangeSummary().getErrors();
            assertEquals(2, errors.size());
            assertSame(readError, errors.get(0));
            assertEquals(RowError.Kind.MALFORMED_EXTRACT, errors.get(1).getKind());
        }
    }
}
