package com.example.contentpipeline.integration.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Structured answer expected from the model when summarizing. Bound by Spring AI's
 * {@code BeanOutputConverter}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SummaryDraft {

    private String highLevel;
    private List<String> keyTakeaways;
    private List<String> actionItems;

    public SummaryDraft() {
    }

    public String getHighLevel() { return highLevel; }
    public void setHighLevel(String highLevel) { this.highLevel = highLevel; }

    public List<String> getKeyTakeaways() { return keyTakeaways; }
    public void setKeyTakeaways(List<String> keyTakeaways) { this.keyTakeaways = keyTakeaways; }

    public List<String> getActionItems() { return actionItems; }
    public void setActionItems(List<String> actionItems) { this.actionItems = actionItems; }
}
