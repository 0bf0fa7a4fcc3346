package com.nei10u.cosmic.engine;

import com.nei10u.cosmic.calc.TemporalMath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.nei10u.cosmic.calc.TemporalMath.atan2Deg;
import static com.nei10u.cosmic.calc.TemporalMath.cosDeg;
import static com.nei10u.cosmic.calc.TemporalMath.normalizeDegrees;
import static com.nei10u.cosmic.calc.TemporalMath.sinDeg;
import static com.nei10u.cosmic.calc.TemporalMath.tanDeg;
import static com.nei10u.cosmic.calc.TemporalMath.toDegrees;

/**
 * 宫位计算：恒星时 → RAMC → 上升/天顶，Placidus 半弧迭代求 11、12、2、3 宫，
 * 其余宫头取对宫。半弧无定义（|纬度| ≥ 66° 或 acos 越界）时改用 Porphyry 三等分。
 */
public final class HouseCalculator {

    public enum HouseSystem {
        PLACIDUS, PORPHYRY
    }

    /**
     * @param cusps 第 1 到第 12 宫宫头黄经，下标 0 为第 1 宫
     */
    public record HouseCusps(List<Double> cusps, double ascendant, double midheaven, HouseSystem system) {

        public double cusp(int house) {
            return cusps.get(house - 1);
        }

        /**
         * 黄经所在宫位，1 到 12。
         */
        public int houseOf(double longitude) {
            double lon = normalizeDegrees(longitude);
            for (int i = 0; i < 12; i++) {
                double start = cusps.get(i);
                double end = cusps.get((i + 1) % 12);
                double span = normalizeDegrees(end - start);
                if (normalizeDegrees(lon - start) < span) {
                    return i + 1;
                }
            }
            return 1;
        }
    }

    static final double POLAR_LATITUDE_LIMIT = 66.0;
    private static final int MAX_ITERATIONS = 50;
    private static final double TOLERANCE = 1e-7;

    private HouseCalculator() {
    }

    /**
     * 格林尼治平恒星时（度）。
     */
    public static double greenwichSiderealTime(double jd) {
        double t = TemporalMath.julianCenturies(jd);
        return normalizeDegrees(280.46061837
                + 360.98564736629 * (jd - TemporalMath.J2000)
                + 0.000387933 * t * t
                - t * t * t / 38710000.0);
    }

    public static double obliquity(double t) {
        return 23.4393 - 0.0130 * t;
    }

    /**
     * @param latitude  地理纬度，北正
     * @param longitude 地理经度，东正
     */
    public static HouseCusps calculate(double jd, double latitude, double longitude) {
        double t = TemporalMath.julianCenturies(jd);
        double eps = obliquity(t);
        double ramc = normalizeDegrees(greenwichSiderealTime(jd) + longitude);

        double mc = atan2Deg(sinDeg(ramc), cosDeg(ramc) * cosDeg(eps));
        double asc = atan2Deg(cosDeg(ramc), -(sinDeg(eps) * tanDeg(latitude) + cosDeg(eps) * sinDeg(ramc)));

        if (Math.abs(latitude) < POLAR_LATITUDE_LIMIT) {
            double[] intermediate = placidusIntermediate(ramc, eps, latitude);
            if (intermediate != null) {
                return assemble(asc, mc, intermediate, HouseSystem.PLACIDUS);
            }
        }
        return assemble(asc, mc, porphyryIntermediate(asc, mc), HouseSystem.PORPHYRY);
    }

    /**
     * 返回 {11, 12, 2, 3} 宫宫头；半弧无定义时返回 null。
     */
    private static double[] placidusIntermediate(double ramc, double eps, double latitude) {
        Double h11 = placidusCusp(ramc, eps, latitude, 1.0 / 3.0, true);
        Double h12 = placidusCusp(ramc, eps, latitude, 2.0 / 3.0, true);
        Double h2 = placidusCusp(ramc, eps, latitude, 2.0 / 3.0, false);
        Double h3 = placidusCusp(ramc, eps, latitude, 1.0 / 3.0, false);
        if (h11 == null || h12 == null || h2 == null || h3 == null) {
            return null;
        }
        return new double[]{h11, h12, h2, h3};
    }

    /**
     * 地平上方：R = RAMC + F·DSA；地平下方：R = RAMC + 180 − F·NSA。
     * 赤纬由当前 R 对应的黄道点求得，迭代到收敛。
     */
    private static Double placidusCusp(double ramc, double eps, double latitude, double fraction, boolean aboveHorizon) {
        double r = aboveHorizon ? ramc + fraction * 90.0 : ramc + 180.0 - fraction * 90.0;
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double tanDeclination = tanDeg(eps) * sinDeg(r);
            double x = -tanDeg(latitude) * tanDeclination;
            if (x < -1.0 || x > 1.0) {
                return null;
            }
            double dsa = toDegrees(Math.acos(x));
            double next = aboveHorizon
                    ? ramc + fraction * dsa
                    : ramc + 180.0 - fraction * (180.0 - dsa);
            if (Math.abs(next - r) < TOLERANCE) {
                r = next;
                break;
            }
            r = next;
        }
        return atan2Deg(sinDeg(r), cosDeg(r) * cosDeg(eps));
    }

    private static double[] porphyryIntermediate(double asc, double mc) {
        double upper = normalizeDegrees(asc - mc);
        double lower = normalizeDegrees(mc + 180.0 - asc);
        return new double[]{
                normalizeDegrees(mc + upper / 3.0),
                normalizeDegrees(mc + 2.0 * upper / 3.0),
                normalizeDegrees(asc + lower / 3.0),
                normalizeDegrees(asc + 2.0 * lower / 3.0)
        };
    }

    private static HouseCusps assemble(double asc, double mc, double[] mid, HouseSystem system) {
        double h11 = mid[0];
        double h12 = mid[1];
        double h2 = mid[2];
        double h3 = mid[3];
        List<Double> cusps = new ArrayList<>(12);
        cusps.add(asc);
        cusps.add(h2);
        cusps.add(h3);
        cusps.add(normalizeDegrees(mc + 180.0));
        cusps.add(normalizeDegrees(h11 + 180.0));
        cusps.add(normalizeDegrees(h12 + 180.0));
        cusps.add(normalizeDegrees(asc + 180.0));
        cusps.add(normalizeDegrees(h2 + 180.0));
        cusps.add(normalizeDegrees(h3 + 180.0));
        cusps.add(mc);
        cusps.add(h11);
        cusps.add(h12);
        return new HouseCusps(Collections.unmodifiableList(cusps), asc, mc, system);
    }
}
