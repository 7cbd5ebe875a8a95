package com.arrangement.core.model;

public record ClipMetadata(String name, String color) {

    public static ClipMetadata named(String name) {
        return new ClipMetadata(name, null);
    }
}
