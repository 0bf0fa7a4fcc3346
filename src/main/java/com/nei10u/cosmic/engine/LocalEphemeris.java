package com.nei10u.cosmic.engine;

import com.nei10u.cosmic.calc.TemporalMath;
import com.nei10u.cosmic.config.EphemerisProperties;
import com.nei10u.cosmic.model.BirthData;
import com.nei10u.cosmic.model.CelestialBody;
import com.nei10u.cosmic.model.NatalChart;
import com.nei10u.cosmic.model.PlanetaryPosition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.nei10u.cosmic.calc.TemporalMath.julianCenturies;
import static com.nei10u.cosmic.calc.TemporalMath.normalizeDegrees;

/**
 * 本地星历：不依赖任何外部服务，远程不可用时的兜底实现。
 */
@Component
@RequiredArgsConstructor
public class LocalEphemeris {

    private final EphemerisProperties properties;

    public NatalChart calculate(BirthData birth) {
        LocalTime calculationTime = calculationTime(birth);
        double jd = julianDay(birth, calculationTime);
        double t = julianCenturies(jd);

        HouseCalculator.HouseCusps cusps = null;
        if (birth.isTimeKnown() && birth.hasCoordinates()) {
            cusps = HouseCalculator.calculate(jd, birth.getLatitude().get(), birth.getLongitude().get());
        }

        List<PlanetaryPosition> positions = new ArrayList<>();
        for (CelestialBody body : CelestialBody.values()) {
            double longitude = EphemerisSeries.longitude(body, t);
            positions.add(ChartAssembler.position(body, longitude, isRetrograde(body, jd), null, cusps));
        }
        return ChartAssembler.chart(positions, cusps, AspectCalculator.calculate(positions),
                birth.isTimeKnown(), calculationTime);
    }

    /**
     * 出生时间；未知时取配置的参考时刻（默认正午）。
     */
    public LocalTime calculationTime(BirthData birth) {
        return birth.getTime().orElse(properties.getUnknownTimeReference());
    }

    /**
     * 当地时刻按出生时区换成 UT 后的儒略日；无时区按 UT。
     */
    static double julianDay(BirthData birth, LocalTime localTime) {
        ZoneId zone = birth.getZone().orElse(ZoneOffset.UTC);
        LocalDateTime utc = birth.getDate().atTime(localTime)
                .atZone(zone)
                .withZoneSameInstant(ZoneOffset.UTC)
                .toLocalDateTime();
        return TemporalMath.julianDay(utc);
    }

    /**
     * 前后各半日的地心黄经差为负即逆行。日月不逆行，平交点恒逆行。
     */
    static boolean isRetrograde(CelestialBody body, double jd) {
        switch (body) {
            case SUN:
            case MOON:
                return false;
            case NORTH_NODE:
                return true;
            default:
                double before = EphemerisSeries.longitude(body, julianCenturies(jd - 0.5));
                double after = EphemerisSeries.longitude(body, julianCenturies(jd + 0.5));
                double delta = normalizeDegrees(after - before + 180.0) - 180.0;
                return delta < 0;
        }
    }
}
