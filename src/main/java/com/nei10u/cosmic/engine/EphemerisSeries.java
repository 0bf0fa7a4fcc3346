package com.nei10u.cosmic.engine;

import com.nei10u.cosmic.model.CelestialBody;

import java.util.EnumMap;
import java.util.Map;

import static com.nei10u.cosmic.calc.TemporalMath.atan2Deg;
import static com.nei10u.cosmic.calc.TemporalMath.cosDeg;
import static com.nei10u.cosmic.calc.TemporalMath.normalizeDegrees;
import static com.nei10u.cosmic.calc.TemporalMath.sinDeg;
import static com.nei10u.cosmic.calc.TemporalMath.toDegrees;

/**
 * 低阶三角级数星历（Meeus 风格截断）。
 * <p>
 * 太阳：平黄经 + 两项中心差；月亮：35 项周期项 + 三个附加项；
 * 行星：日心平黄经 + 两项中心差，再以地球（太阳 + 180°）换算地心黄经。
 * 精度到星座级别，不适合亚度级相位分析。入参 t 均为 J2000.0 起的儒略世纪数。
 */
final class EphemerisSeries {

    /**
     * 行星平根数：J2000 平黄经、每儒略世纪变化率、近日点黄经、偏心率、半长轴(AU)。
     */
    private record OrbitalElements(double meanLongitude, double rate, double perihelion,
                                   double eccentricity, double semiMajorAxis) {
    }

    private static final Map<CelestialBody, OrbitalElements> ELEMENTS = new EnumMap<>(CelestialBody.class);

    static {
        ELEMENTS.put(CelestialBody.MERCURY, new OrbitalElements(252.25084, 149472.67411, 77.45645, 0.20563, 0.38710));
        ELEMENTS.put(CelestialBody.VENUS, new OrbitalElements(181.97973, 58517.81539, 131.53298, 0.00677, 0.72333));
        ELEMENTS.put(CelestialBody.MARS, new OrbitalElements(355.45332, 19140.29934, 336.04084, 0.09341, 1.52368));
        ELEMENTS.put(CelestialBody.JUPITER, new OrbitalElements(34.40438, 3034.74612, 14.75385, 0.04849, 5.20260));
        ELEMENTS.put(CelestialBody.SATURN, new OrbitalElements(49.94432, 1222.49362, 92.43194, 0.05551, 9.55491));
        ELEMENTS.put(CelestialBody.URANUS, new OrbitalElements(313.23218, 428.48202, 170.96424, 0.04630, 19.21845));
        ELEMENTS.put(CelestialBody.NEPTUNE, new OrbitalElements(304.88003, 218.45947, 44.97135, 0.00899, 30.11039));
        ELEMENTS.put(CelestialBody.PLUTO, new OrbitalElements(238.92881, 145.20780, 224.06676, 0.24881, 39.54));
    }

    // 月亮黄经周期项：D, M, M', F, 系数(1e-6 度)
    private static final int[][] MOON_TERMS = {
            {0, 0, 1, 0, 6288774},
            {2, 0, -1, 0, 1274027},
            {2, 0, 0, 0, 658314},
            {0, 0, 2, 0, 213618},
            {0, 1, 0, 0, -185116},
            {0, 0, 0, 2, -114332},
            {2, 0, -2, 0, 58793},
            {2, -1, -1, 0, 57066},
            {2, 0, 1, 0, 53322},
            {2, -1, 0, 0, 45758},
            {0, 1, -1, 0, -40923},
            {1, 0, 0, 0, -34720},
            {0, 1, 1, 0, -30383},
            {2, 0, 0, -2, 15327},
            {0, 0, 1, 2, -12528},
            {0, 0, 1, -2, 10980},
            {4, 0, -1, 0, 10675},
            {0, 0, 3, 0, 10034},
            {4, 0, -2, 0, 8548},
            {2, 1, -1, 0, -7888},
            {2, 1, 0, 0, -6766},
            {1, 0, -1, 0, -5163},
            {1, 1, 0, 0, 4987},
            {2, -1, 1, 0, 4036},
            {2, 0, 2, 0, 3994},
            {4, 0, 0, 0, 3861},
            {2, 0, -3, 0, 3665},
            {0, 1, -2, 0, -2689},
            {2, 0, -1, 2, -2602},
            {2, -1, -2, 0, 2390},
            {1, 0, 1, 0, -2348},
            {2, -2, 0, 0, 2236},
            {0, 1, 2, 0, -2120},
            {0, 2, 0, 0, -2069},
            {2, -2, -1, 0, 2048}
    };

    private EphemerisSeries() {
    }

    static int moonTermCount() {
        return MOON_TERMS.length;
    }

    static double sunMeanAnomaly(double t) {
        return normalizeDegrees(357.52911 + 35999.05029 * t - 0.0001537 * t * t);
    }

    static double sunLongitude(double t) {
        double l0 = 280.46646 + 36000.76983 * t + 0.0003032 * t * t;
        double m = sunMeanAnomaly(t);
        double center = (1.914602 - 0.004817 * t) * sinDeg(m) + 0.019993 * sinDeg(2 * m);
        return normalizeDegrees(l0 + center);
    }

    /**
     * 日地距离 (AU)。
     */
    static double sunDistance(double t) {
        double m = sunMeanAnomaly(t);
        return 1.000140 - 0.016708 * cosDeg(m) - 0.000141 * cosDeg(2 * m);
    }

    static double moonLongitude(double t) {
        double t2 = t * t;
        double t3 = t2 * t;
        double t4 = t3 * t;
        double lp = 218.3164477 + 481267.88123421 * t - 0.0015786 * t2 + t3 / 538841.0 - t4 / 65194000.0;
        double d = 297.8501921 + 445267.1114034 * t - 0.0018819 * t2 + t3 / 545868.0 - t4 / 113065000.0;
        double m = 357.5291092 + 35999.0502909 * t - 0.0001536 * t2 + t3 / 24490000.0;
        double mp = 134.9633964 + 477198.8675055 * t + 0.0087414 * t2 + t3 / 69699.0 - t4 / 14712000.0;
        double f = 93.2720950 + 483202.0175233 * t - 0.0036539 * t2 - t3 / 3526000.0 + t4 / 863310000.0;
        double e = 1.0 - 0.002516 * t - 0.0000074 * t2;

        double sum = 0.0;
        for (int[] term : MOON_TERMS) {
            double arg = term[0] * d + term[1] * m + term[2] * mp + term[3] * f;
            double coefficient = term[4];
            int eccentricityPower = Math.abs(term[1]);
            if (eccentricityPower == 1) {
                coefficient *= e;
            } else if (eccentricityPower == 2) {
                coefficient *= e * e;
            }
            sum += coefficient * sinDeg(arg);
        }

        // 金星、木星摄动与地球扁率
        double a1 = 119.75 + 131.849 * t;
        double a2 = 53.09 + 479264.290 * t;
        sum += 3958 * sinDeg(a1) + 1962 * sinDeg(lp - f) + 318 * sinDeg(a2);

        return normalizeDegrees(lp + sum / 1_000_000.0);
    }

    /**
     * 月亮平升交点黄经。
     */
    static double meanNodeLongitude(double t) {
        return normalizeDegrees(125.04452 - 1934.136261 * t + 0.0020708 * t * t + t * t * t / 450000.0);
    }

    /**
     * 行星地心视黄经（忽略轨道倾角与光行差）。
     */
    static double planetLongitude(CelestialBody body, double t) {
        OrbitalElements el = ELEMENTS.get(body);
        if (el == null) {
            throw new IllegalArgumentException("No orbital elements for " + body);
        }
        double meanLongitude = normalizeDegrees(el.meanLongitude() + el.rate() * t);
        double meanAnomaly = normalizeDegrees(meanLongitude - el.perihelion());
        double e = el.eccentricity();
        double center = toDegrees((2 * e - e * e * e / 4) * sinDeg(meanAnomaly) + 1.25 * e * e * sinDeg(2 * meanAnomaly));
        double helioLongitude = normalizeDegrees(meanLongitude + center);
        double trueAnomaly = meanAnomaly + center;
        double radius = el.semiMajorAxis() * (1 - e * e) / (1 + e * cosDeg(trueAnomaly));

        double earthLongitude = normalizeDegrees(sunLongitude(t) + 180.0);
        double earthRadius = sunDistance(t);

        double x = radius * cosDeg(helioLongitude) - earthRadius * cosDeg(earthLongitude);
        double y = radius * sinDeg(helioLongitude) - earthRadius * sinDeg(earthLongitude);
        return atan2Deg(y, x);
    }

    /**
     * 任一天体的地心黄经，交点取平交点。
     */
    static double longitude(CelestialBody body, double t) {
        return switch (body) {
            case SUN -> sunLongitude(t);
            case MOON -> moonLongitude(t);
            case NORTH_NODE -> meanNodeLongitude(t);
            default -> planetLongitude(body, t);
        };
    }
}
