package org.dxworks.tagframe;

public enum Language {
    HTML("html"),
    RAZOR("razor"),
    MARKDOWN("markdown");

    private final String name;

    Language(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
