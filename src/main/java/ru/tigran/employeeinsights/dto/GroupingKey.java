package ru.tigran.employeeinsights.dto;

/**
 * Feedback record attribute an aggregation groups by.
 */
public enum GroupingKey {
    KEYWORD("keyword"),
    CITY("city");

    private final String attribute;

    GroupingKey(String attribute) {
        this.attribute = attribute;
    }

    public String getAttribute() {
        return attribute;
    }
}
