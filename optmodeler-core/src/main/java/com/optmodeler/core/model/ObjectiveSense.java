package com.optmodeler.core.model;

/**
 * Optimization direction of an objective.
 */
public enum ObjectiveSense {
    MINIMIZE("min"),
    MAXIMIZE("max");

    private final String keyword;

    ObjectiveSense(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
