package com.linguabot.model;

public enum IssueKind {
    WORD_ORDER("word order"),
    MISSING_PARTICLE("missing particle"),
    PARTICLE_FORM("particle form"),
    CONJUGATION("conjugation"),
    SPACING("spacing"),
    POLITENESS("politeness level");

    private final String label;

    IssueKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
