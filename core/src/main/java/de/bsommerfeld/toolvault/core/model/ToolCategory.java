package de.bsommerfeld.toolvault.core.model;

public enum ToolCategory {

    ENGINE("Engine"),
    THREE_D("3D"),
    TWO_D("2D"),
    AUDIO("Audio"),
    UNKNOWN("Unknown");

    private final String displayName;

    ToolCategory(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
