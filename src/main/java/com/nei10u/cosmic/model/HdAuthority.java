package com.nei10u.cosmic.model;

/**
 * 内在权威，声明顺序即扫描优先级；OUTER 为兜底。
 */
public enum HdAuthority {
    EMOTIONAL(HdCenter.SOLAR_PLEXUS, "Emotional (Solar Plexus)"),
    SACRAL(HdCenter.SACRAL, "Sacral"),
    SPLENIC(HdCenter.SPLEEN, "Splenic"),
    EGO(HdCenter.HEART, "Ego/Heart"),
    SELF_PROJECTED(HdCenter.G, "Self-Projected"),
    MENTAL(HdCenter.AJNA, "Mental (Environment)"),
    OUTER(null, "Lunar (Outer Authority)");

    private final HdCenter center;
    private final String displayName;

    HdAuthority(HdCenter center, String displayName) {
        this.center = center;
        this.displayName = displayName;
    }

    public HdCenter getCenter() {
        return center;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
