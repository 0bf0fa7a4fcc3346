package com.nei10u.cosmic.engine;

import com.nei10u.cosmic.model.Aspect;
import com.nei10u.cosmic.model.CelestialBody;
import com.nei10u.cosmic.model.HousePosition;
import com.nei10u.cosmic.model.NatalChart;
import com.nei10u.cosmic.model.PlanetaryPosition;
import com.nei10u.cosmic.model.ZodiacSign;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 本地与远程两条路径共用的组盘逻辑，保证两边产出的 NatalChart 结构一致。
 */
final class ChartAssembler {

    private ChartAssembler() {
    }

    /**
     * @param house 已知宫位（远程给出）；为空且 cusps 存在时按宫头推算
     */
    static PlanetaryPosition position(CelestialBody body, double longitude, boolean retrograde,
                                      Integer house, HouseCalculator.HouseCusps cusps) {
        Integer resolved = house;
        if (resolved == null && cusps != null) {
            resolved = cusps.houseOf(longitude);
        }
        return PlanetaryPosition.builder()
                .body(body)
                .longitude(longitude)
                .sign(ZodiacSign.fromLongitude(longitude))
                .house(resolved)
                .retrograde(retrograde)
                .build();
    }

    /**
     * @param cusps 出生时间未知时为 null，此时不产出上升、天顶与宫位
     */
    static NatalChart chart(List<PlanetaryPosition> positions, HouseCalculator.HouseCusps cusps,
                            List<Aspect> aspects, boolean timeKnown, LocalTime calculationTime) {
        List<PlanetaryPosition> ordered = new ArrayList<>(positions);
        ordered.sort(Comparator.comparing(PlanetaryPosition::getBody));

        NatalChart.NatalChartBuilder builder = NatalChart.builder()
                .sunSign(signOf(ordered, CelestialBody.SUN))
                .moonSign(signOf(ordered, CelestialBody.MOON))
                .positions(List.copyOf(ordered))
                .aspects(aspects)
                .timeKnown(timeKnown)
                .calculationTime(calculationTime);

        if (cusps != null) {
            List<HousePosition> houses = new ArrayList<>(12);
            for (int i = 1; i <= 12; i++) {
                double cusp = cusps.cusp(i);
                houses.add(new HousePosition(i, cusp, ZodiacSign.fromLongitude(cusp)));
            }
            builder.houses(List.copyOf(houses))
                    .risingSign(ZodiacSign.fromLongitude(cusps.ascendant()))
                    .midheavenSign(ZodiacSign.fromLongitude(cusps.midheaven()));
        }
        return builder.build();
    }

    private static ZodiacSign signOf(List<PlanetaryPosition> positions, CelestialBody body) {
        return positions.stream()
                .filter(p -> p.getBody() == body)
                .map(PlanetaryPosition::getSign)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(body + " position missing"));
    }
}
