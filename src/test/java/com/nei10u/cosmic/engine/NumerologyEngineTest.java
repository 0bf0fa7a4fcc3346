package com.nei10u.cosmic.engine;

import com.nei10u.cosmic.model.BirthData;
import com.nei10u.cosmic.model.Challenge;
import com.nei10u.cosmic.model.NumerologyNumber;
import com.nei10u.cosmic.model.NumerologyProfile;
import com.nei10u.cosmic.model.PersonalYear;
import com.nei10u.cosmic.model.Pinnacle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NumerologyEngineTest {

    private static final Clock IN_2026 = Clock.fixed(Instant.parse("2026-06-01T00:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate BIRTH = LocalDate.of(1990, 3, 15);

    private final NumerologyEngine engine = new NumerologyEngine(IN_2026);

    @Nested
    @DisplayName("约简")
    class Reduction {

        @Test
        @DisplayName("reduce 保留 11/22/33")
        void keepsMasterNumbers() {
            assertThat(NumerologyEngine.reduce(29)).isEqualTo(11);
            assertThat(NumerologyEngine.reduce(22)).isEqualTo(22);
            assertThat(NumerologyEngine.reduce(33)).isEqualTo(33);
            assertThat(NumerologyEngine.reduce(44)).isEqualTo(8);
            assertThat(NumerologyEngine.reduce(1990)).isEqualTo(1);
            assertThat(NumerologyEngine.reduce(7)).isEqualTo(7);
        }

        @Test
        @DisplayName("digit 一律约到个位")
        void digitIgnoresMasters() {
            assertThat(NumerologyTexts.digit(29)).isEqualTo(2);
            assertThat(NumerologyTexts.digit(11)).isEqualTo(2);
            assertThat(NumerologyTexts.digit(0)).isZero();
        }

        @Test
        void letterValuesCycleEveryNine() {
            assertThat(NumerologyEngine.letterValue('a')).isEqualTo(1);
            assertThat(NumerologyEngine.letterValue('i')).isEqualTo(9);
            assertThat(NumerologyEngine.letterValue('j')).isEqualTo(1);
            assertThat(NumerologyEngine.letterValue('s')).isEqualTo(1);
            assertThat(NumerologyEngine.letterValue('z')).isEqualTo(8);
        }
    }

    @Nested
    @DisplayName("核心数")
    class CoreNumbers {

        @Test
        @DisplayName("生命灵数：1990-03-15 → 1，1960-11-02 → 11（大师数）")
        void lifePath() {
            assertThat(NumerologyEngine.lifePath(15, 3, 1990).getValue()).isEqualTo(1);

            NumerologyNumber master = NumerologyEngine.lifePath(2, 11, 1960);
            assertThat(master.getValue()).isEqualTo(11);
            assertThat(master.isMasterNumber()).isTrue();
            assertThat(master.getKind()).isEqualTo(NumerologyNumber.Kind.LIFE_PATH);
        }

        @Test
        @DisplayName("John Smith：表达 8，灵魂渴望 6，人格 11")
        void nameNumbers() {
            String letters = NumerologyEngine.lettersOf("John Smith");

            assertThat(letters).isEqualTo("johnsmith");
            assertThat(NumerologyEngine.expression(letters).getValue()).isEqualTo(8);
            assertThat(NumerologyEngine.soulUrge(letters).getValue()).isEqualTo(6);
            NumerologyNumber personality = NumerologyEngine.personality(letters);
            assertThat(personality.getValue()).isEqualTo(11);
            assertThat(personality.isMasterNumber()).isTrue();
        }

        @Test
        @DisplayName("生日数不保留大师数，关键词最多两个")
        void birthday() {
            NumerologyNumber fifteenth = NumerologyEngine.birthday(15);
            assertThat(fifteenth.getValue()).isEqualTo(6);
            assertThat(fifteenth.isMasterNumber()).isFalse();
            assertThat(fifteenth.getKeywords()).hasSizeLessThanOrEqualTo(2);

            assertThat(NumerologyEngine.birthday(27).getValue()).isEqualTo(9);
            assertThat(NumerologyEngine.birthday(29).getValue()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("巅峰期与挑战数")
    class Cycles {

        @Test
        @DisplayName("1990-03-15：9/7/7/4，第一期止于 35 岁，末期不设终点")
        void pinnacles() {
            List<Pinnacle> pinnacles = NumerologyEngine.pinnacles(1, 15, 3, 1990);

            assertThat(pinnacles).extracting(Pinnacle::number).containsExactly(9, 7, 7, 4);
            assertThat(pinnacles).extracting(Pinnacle::startAge).containsExactly(0, 36, 45, 54);
            assertThat(pinnacles).extracting(Pinnacle::endAge).containsExactly(35, 44, 53, null);
            assertThat(pinnacles.get(3).isOpenEnded()).isTrue();
        }

        @Test
        @DisplayName("主数生命灵数 11（1960-11-02）：第一期止于 25 岁而不是 34 岁")
        void masterLifePathPinnacles() {
            int lifePath = NumerologyEngine.lifePath(2, 11, 1960).getValue();
            List<Pinnacle> pinnacles = NumerologyEngine.pinnacles(lifePath, 2, 11, 1960);

            assertThat(lifePath).isEqualTo(11);
            assertThat(pinnacles).extracting(Pinnacle::number).containsExactly(4, 9, 4, 9);
            assertThat(pinnacles).extracting(Pinnacle::startAge).containsExactly(0, 26, 35, 44);
            assertThat(pinnacles).extracting(Pinnacle::endAge).containsExactly(25, 34, 43, null);
        }

        @Test
        void challenges() {
            List<Challenge> challenges = NumerologyEngine.challenges(15, 3, 1990);

            assertThat(challenges).extracting(Challenge::number).containsExactly(3, 5, 2, 2);
            assertThat(challenges).extracting(Challenge::period).containsExactly(1, 2, 3, 4);
        }

        @Test
        @DisplayName("挑战数 0 有自己的含义")
        void zeroChallenge() {
            List<Challenge> challenges = NumerologyEngine.challenges(1, 1, 2008);
            assertThat(challenges.get(0).number()).isZero();
            assertThat(challenges.get(0).meaning()).startsWith("The challenge of all challenges");
        }
    }

    @Nested
    @DisplayName("个人年")
    class PersonalYears {

        @Test
        void explicitYear() {
            PersonalYear year = NumerologyEngine.personalYear(BIRTH, 2026);

            assertThat(year.value()).isEqualTo(1);
            assertThat(year.theme()).isEqualTo("New beginnings and fresh starts");
            assertThat(year.calendarYear()).isEqualTo(2026);
        }

        @Test
        @DisplayName("“今年”取自注入的 Clock")
        void followsClock() {
            assertThat(engine.currentPersonalYear(BIRTH).calendarYear()).isEqualTo(2026);

            NumerologyEngine nextYear = new NumerologyEngine(
                    Clock.fixed(Instant.parse("2027-01-02T00:00:00Z"), ZoneOffset.UTC));
            PersonalYear year = nextYear.currentPersonalYear(BIRTH);
            assertThat(year.calendarYear()).isEqualTo(2027);
            assertThat(year.value()).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("calculate 汇总全部数字")
    void calculate() {
        NumerologyProfile profile = engine.calculate(BirthData.builder().date(BIRTH).build(), "John Smith");

        assertThat(profile.getLifePath().getValue()).isEqualTo(1);
        assertThat(profile.getExpression().getValue()).isEqualTo(8);
        assertThat(profile.getSoulUrge().getValue()).isEqualTo(6);
        assertThat(profile.getPersonality().getValue()).isEqualTo(11);
        assertThat(profile.getBirthday().getValue()).isEqualTo(6);
        assertThat(profile.getPersonalYear().value()).isEqualTo(1);
        assertThat(profile.getPinnacles()).hasSize(4);
        assertThat(profile.getChallenges()).hasSize(4);
    }

    @Test
    @DisplayName("姓名里没有拉丁字母时拒绝计算")
    void rejectsNameWithoutLetters() {
        assertThatThrownBy(() -> engine.calculate(BirthData.builder().date(BIRTH).build(), "李 雷"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
