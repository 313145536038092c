package com.example.contentpipeline.service;

public class ContentNotFoundException extends RuntimeException {

    private final String itemId;

    public ContentNotFoundException(String itemId) {
        super("No source content found for item '" + itemId + "'");
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
