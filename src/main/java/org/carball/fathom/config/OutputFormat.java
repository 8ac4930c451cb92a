package org.carball.fathom.config;

public enum OutputFormat {
    TEXT,
    JSON,
    BOTH;

    public static OutputFormat fromName(String name) {
        try {
            return OutputFormat.valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid output format '" + name + "'. Use: text, json, or both");
        }
    }
}
