package com.declo.harness;

public enum Category {
    COMPILATION("Compilation"),
    DECOMPILATION("Decompilation"),
    ROUNDTRIP("Roundtrip");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
