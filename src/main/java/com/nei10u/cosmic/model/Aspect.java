package com.nei10u.cosmic.model;

import lombok.Value;

/**
 * 无向相位：bodyA 总是排在 bodyB 之前（按 {@link CelestialBody} 声明顺序）。
 */
@Value
public class Aspect {
    CelestialBody bodyA;
    CelestialBody bodyB;
    AspectType type;
    double orb;

    public boolean involves(CelestialBody body) {
        return bodyA == body || bodyB == body;
    }
}
