package com.nei10u.cosmic.engine;

import com.nei10u.cosmic.calc.TemporalMath;
import com.nei10u.cosmic.model.Aspect;
import com.nei10u.cosmic.model.AspectType;
import com.nei10u.cosmic.model.PlanetaryPosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 相位扫描：每对天体只看一次，夹角落在某个相位容许度内即记一条。
 */
public final class AspectCalculator {

    private AspectCalculator() {
    }

    public static List<Aspect> calculate(List<PlanetaryPosition> positions) {
        List<PlanetaryPosition> ordered = new ArrayList<>(positions);
        ordered.sort(Comparator.comparing(PlanetaryPosition::getBody));

        List<Aspect> aspects = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                PlanetaryPosition a = ordered.get(i);
                PlanetaryPosition b = ordered.get(j);
                double separation = TemporalMath.separation(a.getLongitude(), b.getLongitude());
                for (AspectType type : AspectType.values()) {
                    double orb = Math.abs(separation - type.getAngle());
                    if (orb <= type.getMaxOrb()) {
                        aspects.add(new Aspect(a.getBody(), b.getBody(), type, orb));
                    }
                }
            }
        }
        return Collections.unmodifiableList(aspects);
    }
}
