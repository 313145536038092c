package com.example.contentpipeline.service;

import com.example.contentpipeline.domain.model.Summary;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SummaryValidatorTest {

    private static Summary summary(String highLevel, List<String> takeaways, List<String> actions) {
        return new Summary("demo-001", "en", highLevel, takeaways, actions);
    }

    @Test
    public void testBoundsAreInclusive() {
        assertNotNull(SummaryValidator.validate(summary("Overview.", List.of("1", "2", "3"), List.of("a", "b"))));
        assertNotNull(SummaryValidator.validate(summary("Overview.",
                List.of("1", "2", "3", "4", "5"), List.of("a", "b", "c", "d"))));
    }

    @Test
    public void testTakeawayCountOutOfRange() {
        assertThrows(MalformedOutputException.class,
                () -> SummaryValidator.validate(summary("Overview.", List.of("1", "2"), List.of("a", "b"))));
        assertThrows(MalformedOutputException.class,
                () -> SummaryValidator.validate(summary("Overview.", List.of("1", "2", "3", "4", "5", "6"), List.of("a", "b"))));
    }

    @Test
    public void testActionItemCountOutOfRange() {
        assertThrows(MalformedOutputException.class,
                () -> SummaryValidator.validate(summary("Overview.", List.of("1", "2", "3"), List.of("a"))));
        assertThrows(MalformedOutputException.class,
                () -> SummaryValidator.validate(summary("Overview.", List.of("1", "2", "3"), List.of("a", "b", "c", "d", "e"))));
    }

    @Test
    public void testOverviewMustBeOneNonBlankLine() {
        assertThrows(MalformedOutputException.class,
                () -> SummaryValidator.validate(summary(" ", List.of("1", "2", "3"), List.of("a", "b"))));
        assertThrows(MalformedOutputException.class,
                () -> SummaryValidator.validate(summary("First line.\nSecond line.", List.of("1", "2", "3"), List.of("a", "b"))));
    }

    @Test
    public void testBlankEntryRejected() {
        assertThrows(MalformedOutputException.class,
                () -> SummaryValidator.validate(summary("Overview.", List.of("1", " ", "3"), List.of("a", "b"))));
        assertThrows(MalformedOutputException.class, () -> SummaryValidator.validate(null));
    }
}
