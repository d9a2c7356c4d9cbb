package com.nana.iep.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the immutable value types of the audit domain.
 */
class DomainModelTest {

    private static final LocalDate JAN_1 = LocalDate.of(2025, 1, 1);
    private static final LocalDate JAN_8 = LocalDate.of(2025, 1, 8);
    private static final LocalDate FEB_1 = LocalDate.of(2025, 2, 1);

    private static StudentSummary summary(String code, int sessions) {
        StudentSummary.Builder builder = new StudentSummary.Builder(code);
        for (int i = 0; i < sessions; i++) {
            builder.addSession(new SessionFact(JAN_1.plusDays(i), "Session"));
        }
        return builder.build();
    }

    private static MasterRow row(String code, String name, int sessions) {
        return new MasterRow(Map.of(MasterRow.FIELD_STUDENT_NAME, name), summary(code, sessions));
    }

    // ======================================================================
    // GoalStatus
    // ======================================================================

    @Nested
    @DisplayName("GoalStatus Enum Tests")
    class GoalStatusTests {

        @ParameterizedTest
        @CsvSource({
                "met, MET",
                "Green, MET",
                "yellow, PROGRESSING",
                "RED, NO_PROGRESS",
                "active, ACTIVE",
                "n/a, NOT_APPLICABLE",
                "NO_PROGRESS, NO_PROGRESS"
        })
        @DisplayName("fromToken accepts tokens and stored names case-insensitively")
        void fromToken_knownTokens(String token, GoalStatus expected) {
            assertEquals(Optional.of(expected), GoalStatus.fromToken(token));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "done", "blue"})
        @DisplayName("fromToken returns empty for blank or unknown tokens")
        void fromToken_unknown_isEmpty(String token) {
            assertTrue(GoalStatus.fromToken(token).isEmpty());
        }

        @Test
        @DisplayName("fromToken returns empty for null")
        void fromToken_null_isEmpty() {
            assertTrue(GoalStatus.fromToken(null).isEmpty());
        }

        @Test
        @DisplayName("precedence orders NOT_APPLICABLE lowest and MET highest")
        void precedence_ordering() {
            assertTrue(GoalStatus.NOT_APPLICABLE.precedence() < GoalStatus.ACTIVE.precedence());
            assertTrue(GoalStatus.ACTIVE.precedence() < GoalStatus.NO_PROGRESS.precedence());
            assertTrue(GoalStatus.NO_PROGRESS.precedence() < GoalStatus.PROGRESSING.precedence());
            assertTrue(GoalStatus.PROGRESSING.precedence() < GoalStatus.MET.precedence());
        }

        @Test
        @DisplayName("toString returns the stored name")
        void toString_isName() {
            assertEquals("NO_PROGRESS", GoalStatus.NO_PROGRESS.toString());
            assertEquals("No progress", GoalStatus.NO_PROGRESS.getDisplayName());
        }
    }

    // ======================================================================
    // GoalObservation
    // ======================================================================

    @Nested
    @DisplayName("GoalObservation Retention Tests")
    class GoalObservationTests {

        @Test
        @DisplayName("latest keeps the later date regardless of status")
        void latest_laterDateWins() {
            GoalObservation older = new GoalObservation(GoalStatus.MET, JAN_1);
            GoalObservation newer = new GoalObservation(GoalStatus.ACTIVE, FEB_1);
            assertSame(newer, GoalObservation.latest(older, newer));
            assertSame(newer, GoalObservation.latest(newer, older));
        }

        @Test
        @DisplayName("latest breaks a same-date tie by precedence in either order")
        void latest_sameDate_precedenceWins() {
            GoalObservation red   = new GoalObservation(GoalStatus.NO_PROGRESS, JAN_1);
            GoalObservation green = new GoalObservation(GoalStatus.MET, JAN_1);
            assertSame(green, GoalObservation.latest(red, green));
            assertSame(green, GoalObservation.latest(green, red));
        }

        @Test
        @DisplayName("latest tolerates null on either side")
        void latest_nullSafe() {
            GoalObservation obs = new GoalObservation(GoalStatus.ACTIVE, JAN_1);
            assertSame(obs, GoalObservation.latest(null, obs));
            assertSame(obs, GoalObservation.latest(obs, null));
            assertNull(GoalObservation.latest(null, null));
        }
    }

    // ======================================================================
    // StudentSummary
    // ======================================================================

    @Nested
    @DisplayName("StudentSummary Tests")
    class StudentSummaryTests {

        @Test
        @DisplayName("Builder deduplicates identical session facts")
        void builder_deduplicatesSessions() {
            StudentSummary s = new StudentSummary.Builder("S1")
                    .addSession(new SessionFact(JAN_1, "Maths"))
                    .addSession(new SessionFact(JAN_1, "Maths"))
                    .addSession(new SessionFact(JAN_1, "Reading"))
                    .build();
            assertEquals(2, s.getSessionCount());
        }

        @Test
        @DisplayName("Builder rejects a record for another student")
        void builder_rejectsForeignRecord() {
            StudentSummary.Builder builder = new StudentSummary.Builder("S1");
            assertThrows(IllegalArgumentException.class,
                    () -> builder.add(NormalizedRecord.session("S2", "Maths", JAN_1)));
        }

        @Test
        @DisplayName("Builder rejects a blank student code")
        void builder_rejectsBlankCode() {
            assertThrows(IllegalArgumentException.class, () -> new StudentSummary.Builder(" "));
        }

        @Test
        @DisplayName("mergedWith is idempotent")
        void merge_idempotent() {
            StudentSummary s = new StudentSummary.Builder("S1")
                    .addSession(new SessionFact(JAN_1, "Maths"))
                    .observeGoal("reading", new GoalObservation(GoalStatus.ACTIVE, JAN_1))
                    .build();
            assertEquals(s, s.mergedWith(s));
        }

        @Test
        @DisplayName("mergedWith is commutative, including same-date goal ties")
        void merge_commutative() {
            StudentSummary a = new StudentSummary.Builder("S1")
                    .addSession(new SessionFact(JAN_1, "Maths"))
                    .observeGoal("reading", new GoalObservation(GoalStatus.NO_PROGRESS, JAN_8))
                    .build();
            StudentSummary b = new StudentSummary.Builder("S1")
                    .addSession(new SessionFact(JAN_8, "Maths"))
                    .observeGoal("reading", new GoalObservation(GoalStatus.PROGRESSING, JAN_8))
                    .build();
            assertEquals(a.mergedWith(b), b.mergedWith(a));
            assertEquals(GoalStatus.PROGRESSING, a.mergedWith(b).getGoalStatus().get("reading"));
            assertEquals(2, a.mergedWith(b).getSessionCount());
        }

        @Test
        @DisplayName("mergedWith refuses summaries of different students")
        void merge_differentCodes_throws() {
            assertThrows(IllegalArgumentException.class,
                    () -> summary("S1", 1).mergedWith(summary("S2", 1)));
        }

        @Test
        @DisplayName("getLastSeenDate considers sessions and goals, null when empty")
        void lastSeenDate() {
            StudentSummary s = new StudentSummary.Builder("S1")
                    .addSession(new SessionFact(JAN_8, "Maths"))
                    .observeGoal("reading", new GoalObservation(GoalStatus.MET, FEB_1))
                    .build();
            assertEquals(FEB_1, s.getLastSeenDate());
            assertNull(new StudentSummary.Builder("S2").build().getLastSeenDate());
        }
    }

    // ======================================================================
    // MasterRow
    // ======================================================================

    @Nested
    @DisplayName("MasterRow Tests")
    class MasterRowTests {

        @Test
        @DisplayName("overlayIdentity keeps existing values for blank incoming fields")
        void overlayIdentity_ignoresBlanks() {
            MasterRow r = new MasterRow(Map.of(MasterRow.FIELD_STUDENT_NAME, "Ana", "Year", "7"),
                    summary("S1", 1));
            Map<String, String> merged = r.overlayIdentity(Map.of("Year", " ", "Class", "7B"));
            assertEquals("Ana", merged.get(MasterRow.FIELD_STUDENT_NAME));
            assertEquals("7", merged.get("Year"));
            assertEquals("7B", merged.get("Class"));
        }

        @Test
        @DisplayName("hasGoal and goalStatusFor match categories by keyword, case-insensitively")
        void trackedGoals_keywordMatch() {
            StudentSummary s = new StudentSummary.Builder("S1")
                    .observeGoal("numeracy - fractions", new GoalObservation(GoalStatus.PROGRESSING, JAN_1))
                    .build();
            MasterRow r = new MasterRow(null, s);
            assertTrue(r.hasGoal("Numeracy"));
            assertEquals(Optional.of(GoalStatus.PROGRESSING), r.goalStatusFor("numeracy"));
            assertFalse(r.hasGoal("wellbeing"));
            assertTrue(r.goalStatusFor("wellbeing").isEmpty());
        }
    }

    // ======================================================================
    // MasterTable
    // ======================================================================

    @Nested
    @DisplayName("MasterTable Tests")
    class MasterTableTests {

        @Test
        @DisplayName("of rejects duplicate student codes")
        void of_duplicateCodes_throws() {
            assertThrows(IllegalArgumentException.class,
                    () -> MasterTable.of(List.of(row("S1", "A", 1), row("S1", "B", 2))));
        }

        @Test
        @DisplayName("positionOf and find follow row order")
        void positionLookup() {
            MasterTable t = MasterTable.of(List.of(row("S1", "A", 1), row("S2", "B", 2)));
            assertEquals(1, t.positionOf("S2"));
            assertEquals(-1, t.positionOf("S9"));
            assertTrue(t.find("S1").isPresent());
            assertFalse(t.contains("S9"));
        }

        @Test
        @DisplayName("rankedBySessionCount orders by count desc then name without reordering the table")
        void rankedBySessionCount() {
            MasterTable t = MasterTable.of(List.of(
                    row("S1", "Zoe", 2), row("S2", "Adam", 2), row("S3", "Bea", 5)));
            List<MasterRow> ranked = t.rankedBySessionCount();
            assertEquals(List.of("S3", "S2", "S1"),
                    ranked.stream().map(MasterRow::getStudentCode).toList());
            assertEquals("S1", t.getRows().get(0).getStudentCode());
        }

        @Test
        @DisplayName("empty table has no rows")
        void empty() {
            assertTrue(MasterTable.empty().isEmpty());
            assertEquals(MasterTable.empty(), MasterTable.of(List.of()));
        }
    }
}
