package com.nei10u.cosmic.service;

import com.nei10u.cosmic.model.CelestialBody;
import com.nei10u.cosmic.model.CosmicFingerprint;
import com.nei10u.cosmic.model.GeneKey;
import com.nei10u.cosmic.model.HumanDesignProfile;
import com.nei10u.cosmic.model.KabbalahProfile;
import com.nei10u.cosmic.model.NatalChart;
import com.nei10u.cosmic.model.NumerologyNumber;
import com.nei10u.cosmic.model.NumerologyProfile;
import com.nei10u.cosmic.model.PersonalYear;
import com.nei10u.cosmic.model.PlanetaryPosition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 把指纹压成给 LLM 用的纯文本上下文。只输出名称与数值，不输出任何查表下标。
 */
@Component
public class FingerprintContextFormatter {

    static final String HEADER = "--- THIS PERSON'S COSMIC FINGERPRINT ---";
    static final String FOOTER = "---";

    public String contextBlock(CosmicFingerprint fp) {
        NatalChart chart = fp.getNatalChart();
        HumanDesignProfile hd = fp.getHumanDesign();
        KabbalahProfile kabbalah = fp.getKabbalah();
        NumerologyProfile numerology = fp.getNumerology();

        StringBuilder sb = new StringBuilder();
        sb.append(HEADER).append('\n');
        line(sb, "Sun", chart.getSunSign().getDisplayName());
        line(sb, "Moon", chart.getMoonSign().getDisplayName());
        chart.getRisingSign().ifPresent(s -> line(sb, "Rising", s.getDisplayName()));
        chart.getMidheavenSign().ifPresent(s -> line(sb, "Midheaven", s.getDisplayName()));
        line(sb, "Human Design Type", hd.getType().getDisplayName());
        line(sb, "HD Strategy", hd.getStrategy());
        line(sb, "HD Authority", hd.getAuthority().getDisplayName());
        line(sb, "HD Profile", hd.getProfile());
        if (fp.getGeneKeys() != null) {
            geneKey(sb, "Gene Keys Life's Work", fp.getGeneKeys().getLifeWork());
            geneKey(sb, "Gene Keys Evolution", fp.getGeneKeys().getEvolution());
        }
        line(sb, "Soul Correction", kabbalah.getSoulCorrection().name());
        line(sb, "Birth Sephirah", kabbalah.getBirthSephirah().name() + " (" + kabbalah.getBirthSephirah().meaning() + ")");
        number(sb, numerology.getLifePath());
        number(sb, numerology.getExpression());
        number(sb, numerology.getSoulUrge());
        number(sb, numerology.getPersonality());
        number(sb, numerology.getBirthday());
        PersonalYear year = numerology.getPersonalYear();
        line(sb, "Personal Year", year.value() + " in " + year.calendarYear() + " (" + year.theme() + ")");
        if (fp.getSynthesis() != null) {
            line(sb, "Core Themes", String.join(", ", fp.getSynthesis().getCoreThemes()));
            line(sb, "Life Purpose", fp.getSynthesis().getLifePurpose());
        }
        sb.append(FOOTER).append('\n');
        return sb.toString();
    }

    /**
     * 人生使命用的五要素：太阳、北交点、南交点（北交点对宫）、天顶、土星。
     */
    public String purposeContext(NatalChart chart) {
        List<String> lines = new ArrayList<>();
        chart.position(CelestialBody.SUN).ifPresent(sun ->
                lines.add(CelestialBody.SUN.getSymbol() + " Sun: " + sun.getSign() + houseSuffix(sun)));
        chart.position(CelestialBody.NORTH_NODE).ifPresent(nn -> {
            lines.add(CelestialBody.NORTH_NODE.getSymbol() + " North Node: " + nn.getSign() + houseSuffix(nn));
            lines.add("☋ South Node: " + nn.getSign().opposite() + " (comfort zone / past life patterns)");
        });
        chart.getMidheavenSign().ifPresent(mc ->
                lines.add("MC (Midheaven): " + mc + ": public role, career direction, legacy"));
        chart.position(CelestialBody.SATURN).ifPresent(sat ->
                lines.add(CelestialBody.SATURN.getSymbol() + " Saturn: " + sat.getSign() + houseSuffix(sat)
                        + ": discipline, mastery, life lessons"));
        return String.join("\n", lines);
    }

    private static String houseSuffix(PlanetaryPosition p) {
        return p.getHouse().map(h -> " in House " + h).orElse("");
    }

    private static void number(StringBuilder sb, NumerologyNumber n) {
        String value = n.isMasterNumber() ? n.getValue() + " (master number)" : String.valueOf(n.getValue());
        line(sb, n.getKind().getDisplayName(), value);
    }

    private static void geneKey(StringBuilder sb, String label, GeneKey key) {
        line(sb, label, key.shadow() + " > " + key.gift() + " > " + key.siddhi() + " (" + key.theme() + ")");
    }

    private static void line(StringBuilder sb, String label, String value) {
        sb.append(label).append(": ").append(value).append('\n');
    }
}
