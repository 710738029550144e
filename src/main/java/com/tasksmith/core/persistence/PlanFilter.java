package com.tasksmith.core.persistence;

import com.tasksmith.core.model.Plan;

import java.util.Locale;

/**
 * Narrows {@link PlanStore#listPlans(PlanFilter)}.
 *
 * @param archived true for archived plans only, false for active plans only, null for both
 * @param search   case-insensitive substring of the summary or project path, null or blank for any
 */
public record PlanFilter(Boolean archived, String search) {

    public static final PlanFilter ALL = new PlanFilter(null, null);

    public PlanFilter {
        search = search == null || search.isBlank() ? null : search.strip();
    }

    public boolean matches(Plan plan) {
        if (archived != null && archived != plan.archived()) {
            return false;
        }
        if (search == null) {
            return true;
        }
        String needle = search.toLowerCase(Locale.ROOT);
        return contains(plan.summary(), needle) || contains(plan.projectPath(), needle);
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
