package com.fleet.moderation.api;

/**
 * The moderation actions the facade offers.
 */
public enum ModerationAction {
    SUPER_BAN("superban", true, "cross-scope violation"),
    SUPER_UNBAN("superunban", true, null),
    BAN("ban", false, "spam"),
    UNBAN("unban", false, null),
    KICK("kick", false, "spam"),
    MUTE("mute", false, "disruptive messages"),
    UNMUTE("unmute", false, null);

    private final String label;
    private final boolean fleetWide;
    private final String defaultReason;

    ModerationAction(String label, boolean fleetWide, String defaultReason) {
        this.label = label;
        this.fleetWide = fleetWide;
        this.defaultReason = defaultReason;
    }

    /**
     * Short lowercase name used in logs, metrics and spans.
     */
    public String label() {
        return label;
    }

    public boolean isFleetWide() {
        return fleetWide;
    }

    /**
     * Returns the reason recorded when the caller gives none, or null for lifting actions.
     */
    public String defaultReason() {
        return defaultReason;
    }

    /**
     * Lifting actions may target administrators; restricting ones may not.
     */
    public boolean refusesAdministrators() {
        return defaultReason != null && !fleetWide;
    }
}
