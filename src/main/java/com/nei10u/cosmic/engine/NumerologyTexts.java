package com.nei10u.cosmic.engine;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 数字学释义文本。两位数的非大师数一律先约成个位再查表。
 */
final class NumerologyTexts {

    private static final Map<Integer, String> LIFE_PATH = Map.ofEntries(
            Map.entry(1, "The Leader: You are here to pioneer, to be original, to forge your own path. "
                    + "Independence and self-reliance define your journey."),
            Map.entry(2, "The Peacemaker: You are here to cooperate, to bring balance, to weave harmony from discord. "
                    + "Sensitivity is your superpower."),
            Map.entry(3, "The Creator: You are here to express, to create, to uplift through joy and communication. "
                    + "Your words and art carry light."),
            Map.entry(4, "The Builder: You are here to create lasting foundations. "
                    + "Stability, discipline, and dedication turn your visions into reality."),
            Map.entry(5, "The Adventurer: You are here to experience freedom in all its forms. "
                    + "Change is not your enemy; it is your element."),
            Map.entry(6, "The Nurturer: You are here to love deeply, to care for others, "
                    + "and to create beauty and harmony in the world around you."),
            Map.entry(7, "The Seeker: You are here to go deep, to question, to seek the truth beneath all surfaces. "
                    + "Solitude feeds your wisdom."),
            Map.entry(8, "The Powerhouse: You are here to master the material world. "
                    + "Abundance, authority, and achievement flow when you align with purpose."),
            Map.entry(9, "The Humanitarian: You are here to serve the world with compassion. "
                    + "Your life carries a universal quality; you are meant for everyone."),
            Map.entry(11, "The Intuitive Master: A master number carrying the vibration of spiritual insight and inspiration. "
                    + "You illuminate the path for others."),
            Map.entry(22, "The Master Builder: A master number carrying the power to manifest grand visions into physical reality. "
                    + "You build cathedrals."),
            Map.entry(33, "The Master Teacher: The highest master number. "
                    + "You embody unconditional love and spiritual upliftment. Your very presence heals.")
    );

    private static final Map<Integer, List<String>> KEYWORDS = Map.ofEntries(
            Map.entry(1, List.of("Leadership", "Independence", "Innovation", "Courage")),
            Map.entry(2, List.of("Diplomacy", "Sensitivity", "Partnership", "Balance")),
            Map.entry(3, List.of("Creativity", "Expression", "Joy", "Communication")),
            Map.entry(4, List.of("Stability", "Foundation", "Discipline", "Dedication")),
            Map.entry(5, List.of("Freedom", "Adventure", "Change", "Versatility")),
            Map.entry(6, List.of("Love", "Nurturing", "Responsibility", "Beauty")),
            Map.entry(7, List.of("Wisdom", "Introspection", "Spirituality", "Analysis")),
            Map.entry(8, List.of("Abundance", "Power", "Achievement", "Authority")),
            Map.entry(9, List.of("Compassion", "Humanitarianism", "Wisdom", "Completion")),
            Map.entry(11, List.of("Intuition", "Illumination", "Inspiration", "Mastery")),
            Map.entry(22, List.of("Vision", "Manifestation", "Legacy", "Architecture")),
            Map.entry(33, List.of("Healing", "Teaching", "Unconditional Love", "Service"))
    );

    private static final List<String> EXPRESSION = List.of(
            "leadership and originality",
            "cooperation and sensitivity",
            "creativity and communication",
            "structure and reliability",
            "versatility and freedom",
            "love and responsibility",
            "wisdom and depth",
            "achievement and mastery",
            "compassion and vision"
    );

    private static final List<String> SOUL_URGE = List.of(
            "independence and the freedom to lead",
            "deep partnership and harmony",
            "creative expression and joyful communication",
            "stability, order, and meaningful work",
            "adventure, variety, and sensory experience",
            "love, family, and creating beauty",
            "truth, solitude, and spiritual understanding",
            "mastery, influence, and material accomplishment",
            "service to humanity and universal compassion"
    );

    private static final List<String> PERSONAL_YEAR = List.of(
            "New beginnings and fresh starts",
            "Patience, partnerships, and gestation",
            "Creative expression and social expansion",
            "Building foundations and hard work",
            "Change, freedom, and adventure",
            "Love, family, and responsibility",
            "Reflection, spirituality, and inner work",
            "Achievement, power, and abundance",
            "Completion, release, and humanitarianism"
    );

    private static final List<String> CHALLENGE = List.of(
            "The challenge of all challenges: finding your own inner compass",
            "The challenge of asserting yourself and standing alone",
            "The challenge of patience, sensitivity, and cooperation",
            "The challenge of self-expression and overcoming self-doubt",
            "The challenge of discipline, commitment, and practical effort",
            "The challenge of handling freedom responsibly",
            "The challenge of responsibility without self-sacrifice",
            "The challenge of trust, faith, and emotional openness",
            "The challenge of power, money, and material mastery",
            "The challenge of letting go and serving the greater good"
    );

    private NumerologyTexts() {
    }

    static String lifePath(int n) {
        String text = LIFE_PATH.get(n);
        if (text == null) {
            text = LIFE_PATH.get(digit(n));
        }
        return text != null ? text : "A unique numerological signature.";
    }

    static List<String> keywords(int n) {
        List<String> words = KEYWORDS.get(n);
        if (words == null) {
            words = KEYWORDS.get(digit(n));
        }
        return words != null ? words : List.of("Unique", "Special");
    }

    static List<String> baseKeywords(int n) {
        return keywords(n > 9 ? digit(n) : n);
    }

    static String expression(int n) {
        int d = n > 9 ? digit(n) : n;
        return d >= 1 && d <= 9
                ? "You express yourself through " + EXPRESSION.get(d - 1) + "."
                : "Your expression carries a unique signature.";
    }

    static String soulUrge(int n) {
        int d = n > 9 ? digit(n) : n;
        return d >= 1 && d <= 9
                ? "Your soul craves " + SOUL_URGE.get(d - 1) + "."
                : "Your soul carries a deep and unique desire.";
    }

    static String personality(int n) {
        return "The world sees you through the lens of the number " + n + ": " + firstTwo(baseKeywords(n)) + ".";
    }

    static String birthday(int n) {
        List<String> words = keywords(n);
        return "Born on a " + n + " day, you carry " + words.get(0).toLowerCase(Locale.ROOT) + " as a natural talent.";
    }

    static String pinnacle(int n) {
        return "A period emphasizing " + firstTwo(baseKeywords(n)) + ".";
    }

    static String personalYear(int n) {
        int d = n > 9 ? digit(n) : n;
        return d >= 1 && d <= 9 ? PERSONAL_YEAR.get(d - 1) : "A unique year of transformation";
    }

    static String challenge(int n) {
        int d = n > 9 ? digit(n) : n;
        return d >= 0 && d <= 9 ? CHALLENGE.get(d) : "A unique challenge for growth.";
    }

    private static String firstTwo(List<String> words) {
        return String.join(" and ", words.subList(0, Math.min(2, words.size()))).toLowerCase(Locale.ROOT);
    }

    /**
     * 不保留大师数的个位约简。
     */
    static int digit(int n) {
        int num = Math.abs(n);
        while (num > 9) {
            int sum = 0;
            for (int v = num; v > 0; v /= 10) {
                sum += v % 10;
            }
            num = sum;
        }
        return num;
    }
}
