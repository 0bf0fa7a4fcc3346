package com.nei10u.cosmic.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * 本命盘。
 * <p>
 * 上升、天顶与宫位只在出生时间已知时存在；时间未知时，行星位置按 calculationTime
 * （配置的参考时刻）计算，并以 timeKnown=false 标明。
 */
@Value
@Builder
public class NatalChart {
    ZodiacSign sunSign;
    ZodiacSign moonSign;
    ZodiacSign risingSign;
    ZodiacSign midheavenSign;
    List<PlanetaryPosition> positions;
    List<HousePosition> houses;
    List<Aspect> aspects;
    boolean timeKnown;
    LocalTime calculationTime;

    public Optional<ZodiacSign> getRisingSign() {
        return Optional.ofNullable(risingSign);
    }

    public Optional<ZodiacSign> getMidheavenSign() {
        return Optional.ofNullable(midheavenSign);
    }

    public Optional<List<HousePosition>> getHouses() {
        return Optional.ofNullable(houses);
    }

    public Optional<PlanetaryPosition> position(CelestialBody body) {
        return positions.stream().filter(p -> p.getBody() == body).findFirst();
    }
}
