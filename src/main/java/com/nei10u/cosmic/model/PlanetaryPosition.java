package com.nei10u.cosmic.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

@Value
@Builder
public class PlanetaryPosition {
    CelestialBody body;
    double longitude;   // 黄经 [0,360)
    ZodiacSign sign;
    Integer house;      // 出生时间未知时为空
    boolean retrograde;

    public Optional<Integer> getHouse() {
        return Optional.ofNullable(house);
    }

    public double getDegreeInSign() {
        return longitude - sign.ordinal() * 30.0;
    }
}
