package com.tripplanner.pojo.enums;

public enum SlotKind {

    BREAKFAST("Breakfast"),
    LUNCH("Lunch"),
    DINNER("Dinner"),
    ACTIVITY("Visit");

    private final String label;

    SlotKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isMeal() {
        return this != ACTIVITY;
    }
}
