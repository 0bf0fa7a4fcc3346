package com.nei10u.cosmic.service;

import com.nei10u.cosmic.model.CelestialBody;
import com.nei10u.cosmic.model.HumanDesignProfile;
import com.nei10u.cosmic.model.KabbalahProfile;
import com.nei10u.cosmic.model.NatalChart;
import com.nei10u.cosmic.model.NumerologyNumber;
import com.nei10u.cosmic.model.NumerologyProfile;
import com.nei10u.cosmic.model.Synthesis;
import com.nei10u.cosmic.model.ZodiacSign;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 四套体系的综合解读，纯模板拼接。上升与天顶只在已知时写入主题。
 */
@Component
public class SynthesisComposer {

    public Synthesis compose(NatalChart chart, HumanDesignProfile hd, KabbalahProfile kabbalah, NumerologyProfile numerology) {
        return Synthesis.builder()
                .lifePurpose(lifePurpose(chart, hd, numerology))
                .coreThemes(coreThemes(chart, hd, kabbalah, numerology))
                .superpower(superpower(chart, hd))
                .shadow(shadow(chart, kabbalah))
                .invitation(invitation(hd, numerology))
                .build();
    }

    String lifePurpose(NatalChart chart, HumanDesignProfile hd, NumerologyProfile numerology) {
        return "As a " + chart.getSunSign() + " Sun with a " + chart.getMoonSign() + " Moon and "
                + hd.getType() + " design, your life purpose flows through a Life Path "
                + numerology.getLifePath().getValue() + " calling. You are designed to "
                + lower(hd.getStrategy()) + " and let your inner authority guide you home.";
    }

    List<String> coreThemes(NatalChart chart, HumanDesignProfile hd, KabbalahProfile kabbalah, NumerologyProfile numerology) {
        ZodiacSign sun = chart.getSunSign();
        NumerologyNumber lifePath = numerology.getLifePath();
        List<String> themes = new ArrayList<>();
        themes.add(sun + " essence: " + sun.getElement() + " energy");
        chart.getRisingSign().ifPresent(rising -> themes.add(rising + " Rising: how the world sees you"));
        themes.add(hd.getType() + ": " + hd.getStrategy());
        themes.add("Soul correction: " + kabbalah.getSoulCorrection().name());
        themes.add("Life Path " + lifePath.getValue() + ": " + firstKeyword(lifePath));
        chart.getMidheavenSign().ifPresent(mc -> themes.add("MC in " + mc + ": your public calling"));
        return List.copyOf(themes);
    }

    String superpower(NatalChart chart, HumanDesignProfile hd) {
        ZodiacSign sun = chart.getSunSign();
        return "Your superpower lives at the intersection of your " + hd.getType() + " energy and your "
                + sun + " " + lower(sun.getElement().getDisplayName()) + " nature. When you "
                + lower(hd.getStrategy()) + ", your gifts naturally radiate.";
    }

    String shadow(NatalChart chart, KabbalahProfile kabbalah) {
        String saturn = chart.position(CelestialBody.SATURN)
                .map(p -> "Saturn in " + p.getSign() + " challenges you to master "
                        + lower(p.getSign().getDisplayName()) + " lessons")
                .orElse("Your Saturn placement teaches patience");
        return saturn + ", connecting to your Kabbalistic challenge of "
                + lower(kabbalah.getSoulCorrection().challenge())
                + ". This is not something to fix; it is the raw material of your transformation.";
    }

    String invitation(HumanDesignProfile hd, NumerologyProfile numerology) {
        NumerologyNumber lifePath = numerology.getLifePath();
        List<String> keywords = lifePath.getKeywords();
        String energy = lower(String.join(" and ", keywords.subList(0, Math.min(2, keywords.size()))));
        return "The invitation is clear: " + lower(hd.getStrategy()) + ", and let your Life Path "
                + lifePath.getValue() + " energy of " + energy + " guide your steps.";
    }

    private static String firstKeyword(NumerologyNumber number) {
        return number.getKeywords().isEmpty() ? "" : number.getKeywords().get(0);
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
