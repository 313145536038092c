package com.example.contentpipeline.domain.model;

import java.util.List;
import java.util.stream.Collectors;

public record SummarySection(String heading, String text) {

    static final String BULLET = "- ";

    public static String bulletList(List<String> items) {
        return items.stream().map(item -> BULLET + item).collect(Collectors.joining("\n"));
    }
}
