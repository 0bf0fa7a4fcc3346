package com.nei10u.cosmic.model;

import java.util.Locale;

/**
 * 相位表，声明顺序即判定优先级。
 */
public enum AspectType {
    CONJUNCTION("Conjunction", 0.0, 8.0),
    OPPOSITION("Opposition", 180.0, 8.0),
    TRINE("Trine", 120.0, 6.0),
    SQUARE("Square", 90.0, 6.0),
    SEXTILE("Sextile", 60.0, 4.0);

    private final String displayName;
    private final double angle;
    private final double maxOrb;

    AspectType(String displayName, double angle, double maxOrb) {
        this.displayName = displayName;
        this.angle = angle;
        this.maxOrb = maxOrb;
    }

    public static AspectType fromName(String name) {
        if (name == null) {
            return null;
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (AspectType type : values()) {
            if (type.displayName.toLowerCase(Locale.ROOT).equals(key) || type.name().toLowerCase(Locale.ROOT).equals(key)) {
                return type;
            }
        }
        return null;
    }

    public String getDisplayName() {
        return displayName;
    }

    public double getAngle() {
        return angle;
    }

    public double getMaxOrb() {
        return maxOrb;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
