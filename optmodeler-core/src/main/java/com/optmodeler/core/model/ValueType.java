package com.optmodeler.core.model;

/**
 * Element type of sets and parameters.
 */
public enum ValueType {
    NUM("num"),
    STR("str");

    private final String keyword;

    ValueType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
