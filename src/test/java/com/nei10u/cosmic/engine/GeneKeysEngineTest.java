package com.nei10u.cosmic.engine;

import com.nei10u.cosmic.model.BirthData;
import com.nei10u.cosmic.model.GeneKey;
import com.nei10u.cosmic.model.GeneKeysProfile;
import com.nei10u.cosmic.model.PearlSequence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeneKeysEngineTest {

    private final GeneKeysEngine engine = new GeneKeysEngine();

    private GeneKeysProfile profileOf(LocalDate date) {
        return engine.calculate(BirthData.builder().date(date).build());
    }

    @Test
    @DisplayName("常量表：64 把钥匙，编号连续，每把三层频率齐全")
    void table() {
        assertThat(GeneKeysTables.GENE_KEYS).hasSize(64);
        for (int i = 0; i < GeneKeysTables.GENE_KEYS.size(); i++) {
            GeneKey key = GeneKeysTables.GENE_KEYS.get(i);
            assertThat(key.number()).isEqualTo(i + 1);
            assertThat(key.shadow()).isNotBlank();
            assertThat(key.gift()).isNotBlank();
            assertThat(key.siddhi()).isNotBlank();
        }
        assertThat(GeneKeysTables.key(64).theme()).isEqualTo("The Aurora");
        assertThatThrownBy(() -> GeneKeysTables.key(65)).isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("激活序列")
    class Activation {

        @Test
        @DisplayName("1990-03-15：志业 21，进化 48，光芒 54，目的 53")
        void example() {
            GeneKeysProfile profile = profileOf(LocalDate.of(1990, 3, 15));

            assertThat(profile.getLifeWork().number()).isEqualTo(21);
            assertThat(profile.getLifeWork().gift()).isEqualTo("Authority");
            assertThat(profile.getEvolution().number()).isEqualTo(48);
            assertThat(profile.getRadiance().number()).isEqualTo(54);
            assertThat(profile.getPurpose().number()).isEqualTo(53);
        }

        @Test
        @DisplayName("与人类图同一闸门轮：志业 / 进化即人格太阳 / 地球，光芒 / 目的即设计太阳 / 地球")
        void sharesWheelWithHumanDesign() {
            LocalDate date = LocalDate.of(1990, 11, 2);
            GeneKeysProfile profile = profileOf(date);

            assertThat(profile.getLifeWork().number()).isEqualTo(HumanDesignEngine.gatesFor(date).get(0)).isEqualTo(34);
            assertThat(profile.getEvolution().number()).isEqualTo(HumanDesignEngine.gatesFor(date).get(1)).isEqualTo(20);
            LocalDate design = date.minusDays(HumanDesignEngine.DESIGN_OFFSET_DAYS);
            assertThat(profile.getRadiance().number()).isEqualTo(HumanDesignEngine.gatesFor(design).get(0)).isEqualTo(40);
            assertThat(profile.getPurpose().number()).isEqualTo(HumanDesignEngine.gatesFor(design).get(1)).isEqualTo(37);
        }

        @Test
        @DisplayName("闰年第 366 天越过 360° 后折回轮首闸门 41")
        void leapYearLastDayWraps() {
            GeneKeysProfile profile = profileOf(LocalDate.of(2000, 12, 31));

            assertThat(profile.getLifeWork().number()).isEqualTo(41);
            assertThat(profile.getEvolution().number()).isEqualTo(31);
        }

        @Test
        @DisplayName("只看日期，出生时刻不影响结果")
        void timeIndependent() {
            BirthData withTime = BirthData.builder().date(LocalDate.of(1990, 3, 15)).time(LocalTime.of(23, 59))
                    .latitude(51.5).longitude(-0.1).build();

            assertThat(engine.calculate(withTime)).isEqualTo(profileOf(LocalDate.of(1990, 3, 15)));
        }
    }

    @Test
    @DisplayName("珍珠序列：3 月 15 日 → 13 / 48 / 27 / 45")
    void pearlSequence() {
        PearlSequence pearl = GeneKeysEngine.pearlSequence(3, 15);

        assertThat(pearl.vocation().number()).isEqualTo(13);
        assertThat(pearl.culture().number()).isEqualTo(48);
        assertThat(pearl.brand().number()).isEqualTo(27);
        assertThat(pearl.pearl().number()).isEqualTo(45);
    }
}
