package com.nei10u.cosmic.engine;

import com.nei10u.cosmic.model.BirthData;
import com.nei10u.cosmic.model.Challenge;
import com.nei10u.cosmic.model.NumerologyNumber;
import com.nei10u.cosmic.model.NumerologyProfile;
import com.nei10u.cosmic.model.PersonalYear;
import com.nei10u.cosmic.model.Pinnacle;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.function.IntPredicate;

/**
 * 数字学：生命灵数、表达数、灵魂渴望数、人格数、生日数、个人年、巅峰期与挑战数。
 * <p>
 * 约简有两种：{@link #reduce} 保留大师数 11/22/33，{@link NumerologyTexts#digit} 一律约到个位。
 * 个人年依赖“今年”，由注入的 {@link Clock} 决定，可随时重算。
 */
@Service
public class NumerologyEngine {

    private static final String VOWELS = "aeiou";

    private final Clock clock;

    public NumerologyEngine(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException 姓名中没有任何 A–Z 字母
     */
    public NumerologyProfile calculate(BirthData birth, String fullName) {
        String letters = lettersOf(fullName);
        if (letters.isEmpty()) {
            throw new IllegalArgumentException("name must contain at least one Latin letter");
        }
        LocalDate date = birth.getDate();
        int day = date.getDayOfMonth();
        int month = date.getMonthValue();
        int year = date.getYear();

        NumerologyNumber lifePath = lifePath(day, month, year);
        return NumerologyProfile.builder()
                .lifePath(lifePath)
                .expression(expression(letters))
                .soulUrge(soulUrge(letters))
                .personality(personality(letters))
                .birthday(birthday(day))
                .personalYear(currentPersonalYear(date))
                .pinnacles(pinnacles(lifePath.getValue(), day, month, year))
                .challenges(challenges(day, month, year))
                .build();
    }

    public PersonalYear currentPersonalYear(LocalDate birthDate) {
        return personalYear(birthDate, LocalDate.now(clock).getYear());
    }

    static PersonalYear personalYear(LocalDate birthDate, int calendarYear) {
        int value = NumerologyTexts.digit(birthDate.getDayOfMonth() + birthDate.getMonthValue()
                + NumerologyTexts.digit(calendarYear));
        return new PersonalYear(value, NumerologyTexts.personalYear(value), calendarYear);
    }

    /**
     * 月、日、年各自约到个位，求和后保留大师数。
     */
    static NumerologyNumber lifePath(int day, int month, int year) {
        int sum = NumerologyTexts.digit(month) + NumerologyTexts.digit(day) + NumerologyTexts.digit(year);
        int value = reduce(sum);
        return number(NumerologyNumber.Kind.LIFE_PATH, value, NumerologyTexts.lifePath(value),
                NumerologyTexts.keywords(value));
    }

    static NumerologyNumber expression(String letters) {
        int value = reduce(letterSum(letters, c -> true));
        return number(NumerologyNumber.Kind.EXPRESSION, value, NumerologyTexts.expression(value),
                NumerologyTexts.baseKeywords(value));
    }

    static NumerologyNumber soulUrge(String letters) {
        int value = reduce(letterSum(letters, c -> VOWELS.indexOf(c) >= 0));
        return number(NumerologyNumber.Kind.SOUL_URGE, value, NumerologyTexts.soulUrge(value),
                NumerologyTexts.baseKeywords(value));
    }

    static NumerologyNumber personality(String letters) {
        int value = reduce(letterSum(letters, c -> VOWELS.indexOf(c) < 0));
        return number(NumerologyNumber.Kind.PERSONALITY, value, NumerologyTexts.personality(value),
                NumerologyTexts.baseKeywords(value));
    }

    static NumerologyNumber birthday(int day) {
        int value = NumerologyTexts.digit(day);
        List<String> keywords = NumerologyTexts.keywords(value);
        return NumerologyNumber.builder()
                .kind(NumerologyNumber.Kind.BIRTHDAY)
                .value(value)
                .masterNumber(false)
                .meaning(NumerologyTexts.birthday(value))
                .keywords(keywords.subList(0, Math.min(2, keywords.size())))
                .build();
    }

    /**
     * P1 = R(m+d)，P2 = R(d+y)，P3 = R(P1+P2)，P4 = R(m+y)。
     * 第一期止于 36 − 生命灵数（主数 11/22/33 不再约简），之后每期 9 年，第四期不设终点。
     */
    static List<Pinnacle> pinnacles(int lifePath, int day, int month, int year) {
        int m = NumerologyTexts.digit(month);
        int d = NumerologyTexts.digit(day);
        int y = NumerologyTexts.digit(year);
        int p1 = reduce(m + d);
        int p2 = reduce(d + y);
        int p3 = reduce(p1 + p2);
        int p4 = reduce(m + y);
        int firstEnd = 36 - lifePath;
        return List.of(
                new Pinnacle(1, p1, NumerologyTexts.pinnacle(p1), 0, firstEnd),
                new Pinnacle(2, p2, NumerologyTexts.pinnacle(p2), firstEnd + 1, firstEnd + 9),
                new Pinnacle(3, p3, NumerologyTexts.pinnacle(p3), firstEnd + 10, firstEnd + 18),
                new Pinnacle(4, p4, NumerologyTexts.pinnacle(p4), firstEnd + 19, null)
        );
    }

    static List<Challenge> challenges(int day, int month, int year) {
        int m = NumerologyTexts.digit(month);
        int d = NumerologyTexts.digit(day);
        int y = NumerologyTexts.digit(year);
        int first = Math.abs(m - d);
        int second = Math.abs(d - y);
        int third = Math.abs(first - second);
        int fourth = Math.abs(m - y);
        return List.of(
                new Challenge(1, first, NumerologyTexts.challenge(first)),
                new Challenge(2, second, NumerologyTexts.challenge(second)),
                new Challenge(3, third, NumerologyTexts.challenge(third)),
                new Challenge(4, fourth, NumerologyTexts.challenge(fourth))
        );
    }

    /**
     * 数位和约简，遇 11、22、33 停止。
     */
    static int reduce(int n) {
        int num = Math.abs(n);
        while (num > 9 && !isMaster(num)) {
            int sum = 0;
            for (int v = num; v > 0; v /= 10) {
                sum += v % 10;
            }
            num = sum;
        }
        return num;
    }

    static boolean isMaster(int n) {
        return n == 11 || n == 22 || n == 33;
    }

    /**
     * A=1 … I=9，J 重新从 1 起，循环。
     */
    static int letterValue(char c) {
        return (c - 'a') % 9 + 1;
    }

    static String lettersOf(String name) {
        if (name == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (char c : name.toLowerCase(Locale.ROOT).toCharArray()) {
            if (c >= 'a' && c <= 'z') {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static int letterSum(String letters, IntPredicate filter) {
        return letters.chars()
                .filter(filter)
                .map(c -> letterValue((char) c))
                .sum();
    }

    private static NumerologyNumber number(NumerologyNumber.Kind kind, int value, String meaning, List<String> keywords) {
        return NumerologyNumber.builder()
                .kind(kind)
                .value(value)
                .masterNumber(isMaster(value))
                .meaning(meaning)
                .keywords(keywords)
                .build();
    }
}
