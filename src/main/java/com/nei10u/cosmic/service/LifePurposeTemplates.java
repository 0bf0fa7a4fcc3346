package com.nei10u.cosmic.service;

import com.nei10u.cosmic.model.CelestialBody;
import com.nei10u.cosmic.model.LifePurposeProfile;
import com.nei10u.cosmic.model.NatalChart;
import com.nei10u.cosmic.model.PlanetaryPosition;
import com.nei10u.cosmic.model.ZodiacSign;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * 人生使命的模板兜底：AI 不可用或输出无法解析时，按太阳、北交点、天顶、土星四个落点拼出完整档案。
 */
final class LifePurposeTemplates {

    private static final Map<ZodiacSign, String> SUN = new EnumMap<>(ZodiacSign.class);
    private static final Map<ZodiacSign, String> NORTH_NODE = new EnumMap<>(ZodiacSign.class);
    private static final Map<ZodiacSign, String> SATURN = new EnumMap<>(ZodiacSign.class);
    private static final Map<ZodiacSign, String> MIDHEAVEN = new EnumMap<>(ZodiacSign.class);

    static {
        SUN.put(ZodiacSign.ARIES, "Pioneering courage and bold action");
        SUN.put(ZodiacSign.TAURUS, "Building lasting value and sensory richness");
        SUN.put(ZodiacSign.GEMINI, "Connecting ideas and communicating truth");
        SUN.put(ZodiacSign.CANCER, "Nurturing and creating emotional sanctuary");
        SUN.put(ZodiacSign.LEO, "Creative self-expression and radiant leadership");
        SUN.put(ZodiacSign.VIRGO, "Sacred service and devotion to craft");
        SUN.put(ZodiacSign.LIBRA, "Creating harmony, beauty, and just relationships");
        SUN.put(ZodiacSign.SCORPIO, "Transformative depth and regenerative power");
        SUN.put(ZodiacSign.SAGITTARIUS, "Expanding horizons and seeking higher truth");
        SUN.put(ZodiacSign.CAPRICORN, "Building enduring structures and earned authority");
        SUN.put(ZodiacSign.AQUARIUS, "Innovating for the collective and honoring uniqueness");
        SUN.put(ZodiacSign.PISCES, "Channeling compassion and transcendent vision");

        NORTH_NODE.put(ZodiacSign.ARIES, "Independent action, courage, and self-leadership");
        NORTH_NODE.put(ZodiacSign.TAURUS, "Stability, self-worth, and trusting your own values");
        NORTH_NODE.put(ZodiacSign.GEMINI, "Curiosity, communication, and embracing many perspectives");
        NORTH_NODE.put(ZodiacSign.CANCER, "Emotional vulnerability, home, and nurturing others");
        NORTH_NODE.put(ZodiacSign.LEO, "Creative self-expression, joy, and being seen");
        NORTH_NODE.put(ZodiacSign.VIRGO, "Humble service, practical wisdom, and sacred routine");
        NORTH_NODE.put(ZodiacSign.LIBRA, "Partnership, diplomacy, and learning to receive");
        NORTH_NODE.put(ZodiacSign.SCORPIO, "Deep transformation, shared resources, and intimate trust");
        NORTH_NODE.put(ZodiacSign.SAGITTARIUS, "Big-picture meaning, faith, and philosophical expansion");
        NORTH_NODE.put(ZodiacSign.CAPRICORN, "Mastery, public contribution, and responsible leadership");
        NORTH_NODE.put(ZodiacSign.AQUARIUS, "Community, innovation, and humanitarian vision");
        NORTH_NODE.put(ZodiacSign.PISCES, "Surrender, spiritual connection, and unconditional compassion");

        SATURN.put(ZodiacSign.ARIES, "Learning to stand alone and trust your instincts");
        SATURN.put(ZodiacSign.TAURUS, "Building material security through patience and persistence");
        SATURN.put(ZodiacSign.GEMINI, "Mastering communication and disciplined thinking");
        SATURN.put(ZodiacSign.CANCER, "Emotional maturity and building true security within");
        SATURN.put(ZodiacSign.LEO, "Earned confidence and authentic creative authority");
        SATURN.put(ZodiacSign.VIRGO, "Perfecting your craft through humble, steady practice");
        SATURN.put(ZodiacSign.LIBRA, "Mastering committed relationships and fair negotiation");
        SATURN.put(ZodiacSign.SCORPIO, "Facing shadows with courage and building inner power");
        SATURN.put(ZodiacSign.SAGITTARIUS, "Grounding your beliefs in real-world wisdom");
        SATURN.put(ZodiacSign.CAPRICORN, "Ultimate mastery: Saturn is home here, and you build empires");
        SATURN.put(ZodiacSign.AQUARIUS, "Structuring your vision for the collective good");
        SATURN.put(ZodiacSign.PISCES, "Giving form to the formless through disciplined spirituality");

        MIDHEAVEN.put(ZodiacSign.ARIES, "Leadership, entrepreneurship, and blazing trails in public");
        MIDHEAVEN.put(ZodiacSign.TAURUS, "Building tangible beauty and lasting financial wisdom");
        MIDHEAVEN.put(ZodiacSign.GEMINI, "Communication, media, teaching, and connecting ideas publicly");
        MIDHEAVEN.put(ZodiacSign.CANCER, "Caregiving, real estate, food, and emotional intelligence in career");
        MIDHEAVEN.put(ZodiacSign.LEO, "Performance, creative direction, and inspiring others publicly");
        MIDHEAVEN.put(ZodiacSign.VIRGO, "Health, analysis, service, and meticulous excellence in your field");
        MIDHEAVEN.put(ZodiacSign.LIBRA, "Law, design, diplomacy, and creating aesthetic harmony");
        MIDHEAVEN.put(ZodiacSign.SCORPIO, "Psychology, research, transformation, and working with hidden truths");
        MIDHEAVEN.put(ZodiacSign.SAGITTARIUS, "Education, publishing, travel, and expanding cultural horizons");
        MIDHEAVEN.put(ZodiacSign.CAPRICORN, "Executive leadership, institution-building, and earned authority");
        MIDHEAVEN.put(ZodiacSign.AQUARIUS, "Technology, social change, and innovation that serves the future");
        MIDHEAVEN.put(ZodiacSign.PISCES, "Healing arts, music, spirituality, and compassionate service");
    }

    // 出生时间未知时没有天顶
    private static final String UNKNOWN_MIDHEAVEN = "a public calling that sharpens once your birth time is known";
    private static final String UNKNOWN_NORTH_NODE = "the growth your soul came here for";

    private LifePurposeTemplates() {
    }

    static LifePurposeProfile fallback(NatalChart chart) {
        PlanetaryPosition sun = chart.position(CelestialBody.SUN)
                .orElseThrow(() -> new IllegalStateException("natal chart has no Sun position"));
        ZodiacSign sunSign = sun.getSign();
        ZodiacSign nodeSign = chart.position(CelestialBody.NORTH_NODE).map(PlanetaryPosition::getSign).orElse(null);
        ZodiacSign saturnSign = chart.position(CelestialBody.SATURN).map(PlanetaryPosition::getSign).orElse(null);

        String sunDesc = SUN.get(sunSign);
        String nodeDesc = nodeSign != null ? NORTH_NODE.get(nodeSign) : UNKNOWN_NORTH_NODE;
        String mcDesc = chart.getMidheavenSign().map(MIDHEAVEN::get).orElse(UNKNOWN_MIDHEAVEN);
        String satDesc = saturnSign != null ? SATURN.get(saturnSign) : null;

        LifePurposeProfile profile = new LifePurposeProfile();
        profile.setPurposeDirection("Your soul is moving toward " + nodeDesc + ". With your Sun in " + sunSign
                + ", your core vitality shines through " + sunDesc
                + ". This lifetime is about growing beyond what's comfortable into what's calling you.");
        profile.setCareerAlignment("Your Midheaven points toward " + mcDesc + ". You thrive in roles where you can "
                + lower(sunDesc) + " while building something meaningful. Look for work that lets your "
                + sunSign + " nature lead.");
        String leadership = "You lead with the " + sunSign + " energy of " + lower(sunDesc) + ".";
        if (satDesc != null) {
            leadership += " Saturn in " + saturnSign + " adds " + lower(satDesc) + " to your authority.";
        }
        profile.setLeadershipStyle(leadership);
        profile.setFulfillmentDrivers("You feel most alive when " + lower(nodeDesc)
                + ". Your South Node patterns may pull you toward old comforts, but your soul grows every time"
                + " you choose the North Node path.");
        profile.setLongTermPath(satDesc == null
                ? "Your long-term mastery unfolds through patience and dedication to your craft."
                : "Saturn teaches you " + lower(satDesc) + ". This is the long game, the mastery that deepens"
                + " with every year. Trust the slow build.");
        profile.setHeadline("Your purpose lives at the intersection of " + sunSign + " vitality and "
                + (nodeSign != null ? nodeSign.getDisplayName() : "cosmic") + " direction.");
        profile.setSourceData(sourceData(chart));
        profile.setFallback(true);
        return profile;
    }

    static LifePurposeProfile.SourceData sourceData(NatalChart chart) {
        LifePurposeProfile.SourceData data = new LifePurposeProfile.SourceData();
        chart.position(CelestialBody.SUN).ifPresent(sun -> {
            data.setSunSign(sun.getSign().getDisplayName());
            data.setSunHouse(sun.getHouse().orElse(null));
        });
        chart.position(CelestialBody.NORTH_NODE).ifPresentOrElse(node -> {
            data.setNorthNodeSign(node.getSign().getDisplayName());
            data.setNorthNodeHouse(node.getHouse().orElse(null));
            data.setSouthNodeSign(node.getSign().opposite().getDisplayName());
        }, () -> {
            data.setNorthNodeSign("Unknown");
            data.setSouthNodeSign("Unknown");
        });
        chart.position(CelestialBody.SATURN).ifPresentOrElse(sat -> {
            data.setSaturnSign(sat.getSign().getDisplayName());
            data.setSaturnHouse(sat.getHouse().orElse(null));
        }, () -> data.setSaturnSign("Unknown"));
        chart.getMidheavenSign().ifPresent(mc -> data.setMidheavenSign(mc.getDisplayName()));
        return data;
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
