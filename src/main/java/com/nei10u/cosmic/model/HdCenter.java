package com.nei10u.cosmic.model;

/**
 * 人类图九大能量中心。
 */
public enum HdCenter {
    HEAD("Head"),
    AJNA("Ajna"),
    THROAT("Throat"),
    G("G Center"),
    HEART("Heart"),
    SACRAL("Sacral"),
    SOLAR_PLEXUS("Solar Plexus"),
    SPLEEN("Spleen"),
    ROOT("Root");

    private final String displayName;

    HdCenter(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
