package com.nei10u.cosmic.service;

import com.nei10u.cosmic.model.CelestialBody;
import com.nei10u.cosmic.model.LifePurposeProfile;
import com.nei10u.cosmic.model.NatalChart;
import com.nei10u.cosmic.model.PlanetaryPosition;
import com.nei10u.cosmic.model.ZodiacSign;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LifePurposeTemplatesTest {

    @Test
    @DisplayName("完整星盘：六个字段都引用对应落点")
    void fullChart() {
        LifePurposeProfile profile = LifePurposeTemplates.fallback(Fingerprints.london().getNatalChart());

        assertThat(profile.isFallback()).isTrue();
        assertThat(profile.getHeadline())
                .isEqualTo("Your purpose lives at the intersection of Pisces vitality and Aquarius direction.");
        assertThat(profile.getPurposeDirection())
                .startsWith("Your soul is moving toward Community, innovation, and humanitarian vision.")
                .contains("With your Sun in Pisces");
        assertThat(profile.getCareerAlignment())
                .startsWith("Your Midheaven points toward Building tangible beauty and lasting financial wisdom.");
        assertThat(profile.getLeadershipStyle())
                .contains("Saturn in Capricorn adds ultimate mastery");
        assertThat(profile.getLongTermPath()).startsWith("Saturn teaches you ultimate mastery");

        LifePurposeProfile.SourceData data = profile.getSourceData();
        assertThat(data.getSunSign()).isEqualTo("Pisces");
        assertThat(data.getSunHouse()).isEqualTo(8);
        assertThat(data.getNorthNodeSign()).isEqualTo("Aquarius");
        assertThat(data.getSouthNodeSign()).isEqualTo("Leo");
        assertThat(data.getMidheavenSign()).isEqualTo("Taurus");
        assertThat(data.getSaturnSign()).isEqualTo("Capricorn");
        assertThat(data.getSaturnHouse()).isEqualTo(6);
    }

    @Test
    @DisplayName("缺北交点、土星与天顶时用通用文案，来源标 Unknown")
    void sparseChart() {
        NatalChart chart = NatalChart.builder()
                .sunSign(ZodiacSign.LEO)
                .moonSign(ZodiacSign.ARIES)
                .positions(List.of(
                        PlanetaryPosition.builder().body(CelestialBody.SUN).longitude(130.0).sign(ZodiacSign.LEO).build(),
                        PlanetaryPosition.builder().body(CelestialBody.MOON).longitude(10.0).sign(ZodiacSign.ARIES).build()))
                .aspects(List.of())
                .timeKnown(false)
                .build();

        LifePurposeProfile profile = LifePurposeTemplates.fallback(chart);

        assertThat(profile.getHeadline()).endsWith("Leo vitality and cosmic direction.");
        assertThat(profile.getPurposeDirection()).startsWith("Your soul is moving toward the growth your soul came here for.");
        assertThat(profile.getCareerAlignment()).contains("once your birth time is known");
        assertThat(profile.getLeadershipStyle()).doesNotContain("Saturn");
        assertThat(profile.getLongTermPath())
                .isEqualTo("Your long-term mastery unfolds through patience and dedication to your craft.");
        assertThat(profile.getSourceData().getNorthNodeSign()).isEqualTo("Unknown");
        assertThat(profile.getSourceData().getSouthNodeSign()).isEqualTo("Unknown");
        assertThat(profile.getSourceData().getSaturnSign()).isEqualTo("Unknown");
        assertThat(profile.getSourceData().getMidheavenSign()).isNull();
        assertThat(profile.getSourceData().getSunHouse()).isNull();
    }
}
