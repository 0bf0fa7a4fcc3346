package com.nei10u.cosmic.engine;

import com.nei10u.cosmic.calc.TemporalMath;
import com.nei10u.cosmic.model.CelestialBody;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * J2000.0 历元的地心黄经，与天文年历对照，容差到度级。
 */
class EphemerisSeriesTest {

    private static final double T0 = 0.0;

    @Test
    @DisplayName("月亮级数至少 30 项")
    void moonSeriesHasEnoughTerms() {
        assertThat(EphemerisSeries.moonTermCount()).isGreaterThanOrEqualTo(30);
    }

    @Test
    void sunAtJ2000() {
        assertThat(EphemerisSeries.sunLongitude(T0)).isCloseTo(280.37, within(0.1));
        assertThat(EphemerisSeries.sunDistance(T0)).isCloseTo(0.9833, within(0.001));
    }

    @Test
    void moonAtJ2000() {
        assertThat(EphemerisSeries.moonLongitude(T0)).isCloseTo(223.32, within(0.5));
    }

    @Test
    void meanNodeAtJ2000() {
        assertThat(EphemerisSeries.meanNodeLongitude(T0)).isCloseTo(125.04, within(0.01));
    }

    @ParameterizedTest(name = "{0} ≈ {1}°")
    @CsvSource({
            "MERCURY, 271.9",
            "VENUS, 241.6",
            "MARS, 327.9",
            "JUPITER, 25.3",
            "SATURN, 40.4",
            "URANUS, 314.8",
            "NEPTUNE, 303.2"
    })
    @DisplayName("行星 J2000 地心黄经误差在 1° 内")
    void planetsAtJ2000(CelestialBody body, double expected) {
        assertThat(EphemerisSeries.planetLongitude(body, T0)).isCloseTo(expected, within(1.0));
    }

    @Test
    @DisplayName("冥王星轨道偏心大，两项中心差误差放宽到 3°")
    void plutoAtJ2000() {
        assertThat(EphemerisSeries.planetLongitude(CelestialBody.PLUTO, T0)).isCloseTo(251.4, within(3.0));
    }

    @Test
    @DisplayName("任意时刻所有天体黄经都在 [0,360)")
    void longitudesAreNormalized() {
        double t = TemporalMath.julianCenturies(TemporalMath.julianDay(1955, 8, 17.25));
        for (CelestialBody body : CelestialBody.values()) {
            assertThat(EphemerisSeries.longitude(body, t)).isGreaterThanOrEqualTo(0.0).isLessThan(360.0);
        }
    }
}
