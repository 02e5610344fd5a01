package com.xendex.backend.enums;

public enum StrategyAngle {
    TRIGGER_LED("trigger_led"),
    PROBLEM_HYPOTHESIS("problem_hypothesis"),
    CASE_STUDY("case_study"),
    VALUE_INSIGHT("value_insight");

    private final String key;

    StrategyAngle(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
