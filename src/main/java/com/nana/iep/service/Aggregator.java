package com.nana.iep.service;

import com.nana.iep.domain.NormalizedRecord;
import com.nana.iep.domain.StudentSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregator - Groups normalized facts by student and builds summaries.
 *
 * <p>RULES:
 * <ul>
 *   <li>Session facts are deduplicated on {@code (date, value)} before
 *       counting, so a session present in two overlapping extracts, or
 *       twice in one extract, counts once.</li>
 *   <li>For each goal category the observation with the latest date is
 *       retained; on the same date an informative status beats
 *       {@code NOT_APPLICABLE}, then {@code MET > PROGRESSING >
 *       NO_PROGRESS > ACTIVE}.</li>
 * </ul>
 *
 * <p>The returned map is keyed by student code in first-seen order.
 */
public class Aggregator {

    private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

    /**
     * Summarises a batch of facts.
     *
     * @param records the facts of one batch; must not be null
     * @return unmodifiable map of student code to summary, first-seen order
     * @throws EmptyGroupException if {@code records} yields no facts
     */
    public Map<String, StudentSummary> aggregate(Iterable<NormalizedRecord> records)
            throws EmptyGroupException {
        Map<String, StudentSummary.Builder> groups = new LinkedHashMap<>();
        int facts = 0;
        for (NormalizedRecord record : records) {
            groups.computeIfAbsent(record.getStudentCode(), StudentSummary.Builder::new)
                  .add(record);
            facts++;
        }
        if (facts == 0) {
            throw new EmptyGroupException("No normalized records to aggregate in this batch.");
        }

        Map<String, StudentSummary> summaries = new LinkedHashMap<>();
        groups.forEach((code, builder) -> summaries.put(code, builder.build()));

        log.info("Aggregated {} facts into {} student summaries.", facts, summaries.size());
        if (log.isDebugEnabled()) {
            summaries.values().forEach(s -> log.debug("  {}", s));
        }
        return Collections.unmodifiableMap(summaries);
    }
}
