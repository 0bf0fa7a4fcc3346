package com.nei10u.cosmic.service;

import com.nei10u.cosmic.config.EphemerisProperties;
import com.nei10u.cosmic.engine.GeneKeysEngine;
import com.nei10u.cosmic.engine.HumanDesignEngine;
import com.nei10u.cosmic.engine.KabbalahEngine;
import com.nei10u.cosmic.engine.LocalEphemeris;
import com.nei10u.cosmic.engine.NumerologyEngine;
import com.nei10u.cosmic.model.BirthData;
import com.nei10u.cosmic.model.CosmicFingerprint;
import com.nei10u.cosmic.model.EphemerisSource;
import com.nei10u.cosmic.model.HumanDesignProfile;
import com.nei10u.cosmic.model.KabbalahProfile;
import com.nei10u.cosmic.model.NatalChart;
import com.nei10u.cosmic.model.NumerologyProfile;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 服务层测试共用的指纹样本，全部由真实引擎同步算出。
 * <p>
 * 伦敦 1990-03-15 14:30：太阳双鱼，月亮天蝎，上升狮子，天顶金牛，北交点水瓶，土星摩羯。
 */
public final class Fingerprints {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-06-01T00:00:00Z"), ZoneOffset.UTC);

    public static final BirthData LONDON = BirthData.builder()
            .date(LocalDate.of(1990, 3, 15))
            .time(LocalTime.of(14, 30))
            .zone(ZoneId.of("Europe/London"))
            .latitude(51.5074)
            .longitude(-0.1278)
            .build();

    public static final BirthData DATE_ONLY = BirthData.builder()
            .date(LocalDate.of(1990, 3, 15))
            .build();

    private Fingerprints() {
    }

    public static CosmicFingerprint of(BirthData birth, String name) {
        NatalChart chart = new LocalEphemeris(new EphemerisProperties()).calculate(birth);
        HumanDesignProfile hd = new HumanDesignEngine().calculate(birth);
        KabbalahProfile kabbalah = new KabbalahEngine().calculate(birth, name);
        NumerologyProfile numerology = new NumerologyEngine(CLOCK).calculate(birth, name);
        return CosmicFingerprint.builder()
                .birthData(birth)
                .fullName(name)
                .natalChart(chart)
                .ephemerisSource(EphemerisSource.LOCAL)
                .humanDesign(hd)
                .geneKeys(new GeneKeysEngine().calculate(birth))
                .kabbalah(kabbalah)
                .numerology(numerology)
                .synthesis(new SynthesisComposer().compose(chart, hd, kabbalah, numerology))
                .generatedAt(Instant.now(CLOCK))
                .build();
    }

    public static CosmicFingerprint london() {
        return of(LONDON, "John Smith");
    }

    public static CosmicFingerprint dateOnly() {
        return of(DATE_ONLY, "John Smith");
    }
}
