package com.nana.iep.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * ReconcilePolicy - Tunables for admitting and reporting master rows.
 *
 * <ul>
 *   <li>{@code minSessionsWithoutGoal} - a student seen for the first time
 *       with no goal facts is only appended once they have at least this
 *       many sessions. {@code 0} admits everyone. Existing rows are never
 *       subject to the threshold.</li>
 *   <li>{@code trackedGoals} - goal keywords shown as "has goal / status"
 *       columns in the change report.</li>
 * </ul>
 */
public final class ReconcilePolicy {

    private final int          minSessionsWithoutGoal;
    private final List<String> trackedGoals;

    public ReconcilePolicy(int minSessionsWithoutGoal, List<String> trackedGoals) {
        if (minSessionsWithoutGoal < 0) {
            throw new IllegalArgumentException(
                    "minSessionsWithoutGoal must be >= 0, got " + minSessionsWithoutGoal + ".");
        }
        this.minSessionsWithoutGoal = minSessionsWithoutGoal;
        List<String> goals = new ArrayList<>();
        if (trackedGoals != null) {
            for (String g : trackedGoals) {
                if (g != null && !g.isBlank()) {
                    goals.add(g.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.trackedGoals = Collections.unmodifiableList(goals);
    }

    /** @return admit every student, track numeracy and wellbeing goals */
    public static ReconcilePolicy defaults() {
        return new ReconcilePolicy(0, List.of("numeracy", "wellbeing"));
    }

    public int getMinSessionsWithoutGoal() { return minSessionsWithoutGoal; }

    public List<String> getTrackedGoals()  { return trackedGoals; }

    @Override
    public String toString() {
        return "ReconcilePolicy{minSessionsWithoutGoal=" + minSessionsWithoutGoal
               + ", trackedGoals=" + trackedGoals + "}";
    }
}
