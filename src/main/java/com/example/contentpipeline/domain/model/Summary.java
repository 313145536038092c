package com.example.contentpipeline.domain.model;

import java.util.List;

public record Summary(String itemId, String language, String highLevel,
                      List<String> keyTakeaways, List<String> actionItems) {

    public Summary {
        keyTakeaways = keyTakeaways == null ? List.of() : List.copyOf(keyTakeaways);
        actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
    }
}
