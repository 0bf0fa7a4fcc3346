package com.nei10u.cosmic.model;

import com.nei10u.cosmic.calc.TemporalMath;

/**
 * 黄道十二宫，按黄经 0° 起每 30° 一宫。
 */
public enum ZodiacSign {
    ARIES("Aries", "♈", Element.FIRE, Modality.CARDINAL),
    TAURUS("Taurus", "♉", Element.EARTH, Modality.FIXED),
    GEMINI("Gemini", "♊", Element.AIR, Modality.MUTABLE),
    CANCER("Cancer", "♋", Element.WATER, Modality.CARDINAL),
    LEO("Leo", "♌", Element.FIRE, Modality.FIXED),
    VIRGO("Virgo", "♍", Element.EARTH, Modality.MUTABLE),
    LIBRA("Libra", "♎", Element.AIR, Modality.CARDINAL),
    SCORPIO("Scorpio", "♏", Element.WATER, Modality.FIXED),
    SAGITTARIUS("Sagittarius", "♐", Element.FIRE, Modality.MUTABLE),
    CAPRICORN("Capricorn", "♑", Element.EARTH, Modality.CARDINAL),
    AQUARIUS("Aquarius", "♒", Element.AIR, Modality.FIXED),
    PISCES("Pisces", "♓", Element.WATER, Modality.MUTABLE);

    public enum Element {
        FIRE("Fire"), EARTH("Earth"), AIR("Air"), WATER("Water");

        private final String displayName;

        Element(String displayName) {
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

    public enum Modality {
        CARDINAL("Cardinal"), FIXED("Fixed"), MUTABLE("Mutable");

        private final String displayName;

        Modality(String displayName) {
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

    private static final ZodiacSign[] SIGNS = values();

    private final String displayName;
    private final String symbol;
    private final Element element;
    private final Modality modality;

    ZodiacSign(String displayName, String symbol, Element element, Modality modality) {
        this.displayName = displayName;
        this.symbol = symbol;
        this.element = element;
        this.modality = modality;
    }

    public static ZodiacSign fromLongitude(double longitude) {
        int index = (int) Math.floor(TemporalMath.normalizeDegrees(longitude) / 30.0);
        return SIGNS[Math.min(index, 11)];
    }

    /**
     * 按英文名匹配（大小写不敏感），找不到返回 null。
     */
    public static ZodiacSign fromName(String name) {
        if (name == null) {
            return null;
        }
        String key = name.trim();
        for (ZodiacSign sign : SIGNS) {
            if (sign.displayName.equalsIgnoreCase(key) || sign.name().equalsIgnoreCase(key)
                    || (key.length() == 3 && sign.displayName.regionMatches(true, 0, key, 0, 3))) {
                return sign;
            }
        }
        return null;
    }

    public ZodiacSign opposite() {
        return SIGNS[(ordinal() + 6) % 12];
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getSymbol() {
        return symbol;
    }

    public Element getElement() {
        return element;
    }

    public Modality getModality() {
        return modality;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
