package com.nana.iep.util;

import com.nana.iep.domain.GoalStatus;
import com.nana.iep.domain.MasterRow;
import com.nana.iep.domain.MasterTable;
import com.nana.iep.service.ChangeSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * AuditReportWriter - Writes the plain-text audit report next to the extract.
 *
 * <p>The report has two parts: the change report of the run, then the
 * master table ranked by session count with one "has goal / status" column
 * pair per tracked goal.
 */
public class AuditReportWriter {

    private static final Logger log = LoggerFactory.getLogger(AuditReportWriter.class);

    static final String REPORT_SUFFIX = "_audit_report.txt";

    private final List<String> trackedGoals;

    public AuditReportWriter(List<String> trackedGoals) {
        this.trackedGoals = List.copyOf(trackedGoals);
    }

    /**
     * @param extractFile the extract the report belongs to
     * @return {@code <extract name without extension>_audit_report.txt} in the same directory
     */
    public static Path reportPathFor(Path extractFile) {
        String name = extractFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        Path parent = extractFile.toAbsolutePath().getParent();
        return parent.resolve(base + REPORT_SUFFIX);
    }

    /**
     * Renders the full report.
     *
     * @param changes the run's change summary
     * @param table   the master table after the run
     * @return the report text
     */
    public String render(ChangeSummary changes, MasterTable table) {
        StringBuilder sb = new StringBuilder(changes.toReportText(trackedGoals));

        sb.append(" MASTER TABLE BY SESSION COUNT (").append(table.size()).append(" students)\n");
        sb.append("-".repeat(60)).append("\n");
        if (table.isEmpty()) {
            sb.append(" No students recorded.\n");
        }
        for (MasterRow row : table.rankedBySessionCount()) {
            sb.append(String.format(" %-12s| %-24s| sessions=%-4d| last=%s",
                    row.getStudentCode(),
                    row.getStudentName(),
                    row.getSummary().getSessionCount(),
                    row.getSummary().getLastSeenDate() == null ? "-" : row.getSummary().getLastSeenDate()));
            for (String goal : trackedGoals) {
                sb.append(" | ").append(goal).append(": ")
                  .append(row.hasGoal(goal) ? "yes" : "no").append('/')
                  .append(row.goalStatusFor(goal).map(GoalStatus::getDisplayName).orElse("-"));
            }
            sb.append("\n");
        }
        sb.append("=".repeat(60)).append("\n");
        return sb.toString();
    }

    /**
     * Writes the report for {@code extractFile}, replacing any previous one.
     *
     * @return the path written
     * @throws IOException if the file cannot be written
     */
    public Path write(Path extractFile, ChangeSummary changes, MasterTable table) throws IOException {
        Path target = reportPathFor(extractFile);
        Files.writeString(target, render(changes, table), StandardCharsets.UTF_8);
        log.info("Audit report written to: {}", target);
        return target;
    }
}
