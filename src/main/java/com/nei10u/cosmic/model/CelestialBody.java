package com.nei10u.cosmic.model;

import java.util.Locale;

public enum CelestialBody {
    SUN("Sun", "☉"),
    MOON("Moon", "☽"),
    MERCURY("Mercury", "☿"),
    VENUS("Venus", "♀"),
    MARS("Mars", "♂"),
    JUPITER("Jupiter", "♃"),
    SATURN("Saturn", "♄"),
    URANUS("Uranus", "♅"),
    NEPTUNE("Neptune", "♆"),
    PLUTO("Pluto", "♇"),
    NORTH_NODE("North Node", "☊");

    private final String displayName;
    private final String symbol;

    CelestialBody(String displayName, String symbol) {
        this.displayName = displayName;
        this.symbol = symbol;
    }

    /**
     * 兼容第三方星历返回的各种写法：Sun / sun / "North Node" / north_node / mean_node / true_node。
     */
    public static CelestialBody fromName(String name) {
        if (name == null) {
            return null;
        }
        String key = compact(name);
        for (CelestialBody body : values()) {
            if (compact(body.name()).equals(key) || compact(body.displayName).equals(key)) {
                return body;
            }
        }
        if (key.equals("meannode") || key.equals("truenode") || key.equals("node") || key.equals("rahu")) {
            return NORTH_NODE;
        }
        return null;
    }

    private static String compact(String raw) {
        return raw.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
    }

    public boolean isLuminary() {
        return this == SUN || this == MOON;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getSymbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
