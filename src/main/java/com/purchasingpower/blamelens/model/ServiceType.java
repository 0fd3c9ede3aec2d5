package com.purchasingpower.blamelens.model;

/**
 * External systems this service talks to, for call logging.
 *
 * @see com.purchasingpower.blamelens.util.ExternalCallLogger
 */
public enum ServiceType {
    GITLAB("🦊", "GitLab"),
    GITHUB("🐙", "GitHub"),
    GIT("🔷", "Git");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
