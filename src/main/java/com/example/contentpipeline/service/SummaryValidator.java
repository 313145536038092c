package com.example.contentpipeline.service;

import com.example.contentpipeline.domain.model.Summary;

import java.util.List;

/**
 * Checks that a generated summary has the required shape: one overview sentence,
 * 3 to 5 key takeaways and 2 to 4 action items, none of them blank.
 */
public final class SummaryValidator {

    public static final int MIN_TAKEAWAYS = 3;
    public static final int MAX_TAKEAWAYS = 5;
    public static final int MIN_ACTION_ITEMS = 2;
    public static final int MAX_ACTION_ITEMS = 4;

    private SummaryValidator() {
    }

    public static Summary validate(Summary summary) {
        if (summary == null) {
            throw new MalformedOutputException("Generator returned no summary");
        }
        if (summary.highLevel() == null || summary.highLevel().isBlank()) {
            throw new MalformedOutputException("Summary for item '" + summary.itemId() + "' has no high-level overview");
        }
        if (summary.highLevel().lines().count() > 1) {
            throw new MalformedOutputException("Summary overview for item '" + summary.itemId() + "' spans several lines");
        }
        requireItems(summary, "key takeaways", summary.keyTakeaways(), MIN_TAKEAWAYS, MAX_TAKEAWAYS);
        requireItems(summary, "action items", summary.actionItems(), MIN_ACTION_ITEMS, MAX_ACTION_ITEMS);
        return summary;
    }

    private static void requireItems(Summary summary, String field, List<String> items, int min, int max) {
        if (items.size() < min || items.size() > max) {
            throw new MalformedOutputException(String.format("Summary for item '%s' has %d %s, expected %d to %d",
                    summary.itemId(), items.size(), field, min, max));
        }
        if (items.stream().anyMatch(item -> item == null || item.isBlank())) {
            throw new MalformedOutputException("Summary for item '" + summary.itemId() + "' has a blank entry in " + field);
        }
    }
}
