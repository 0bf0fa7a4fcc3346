package com.nei10u.cosmic.engine;

import com.nei10u.cosmic.model.BirthData;
import com.nei10u.cosmic.model.KabbalahProfile;
import com.nei10u.cosmic.model.Sephirah;
import com.nei10u.cosmic.model.SoulCorrection;
import com.nei10u.cosmic.model.TreePosition;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 卡巴拉：出生日期 → 灵魂修正与出生质点，姓名数值 + 日期 → 生命之树各质点激活度。
 */
@Service
public class KabbalahEngine {

    public static final int SOUL_CORRECTION_COUNT = 72;

    public KabbalahProfile calculate(BirthData birth, String fullName) {
        LocalDate date = birth.getDate();
        int day = date.getDayOfMonth();
        int month = date.getMonthValue();

        SoulCorrection correction = soulCorrection(soulCorrectionNumber(day, month, date.getYear()));
        Sephirah sephirah = KabbalahTables.SEPHIROT.get((month - 1) % KabbalahTables.SEPHIROT.size());
        int nameValue = nameValue(fullName);

        return KabbalahProfile.builder()
                .soulCorrection(correction)
                .birthSephirah(sephirah)
                .treeOfLifePositions(treePositions(nameValue, day, month))
                .tikkunPath(tikkunPath(correction, sephirah))
                .build();
    }

    /**
     * 日、月、年各自约成一位数后求和，再折回 1..72。
     */
    static int soulCorrectionNumber(int day, int month, int year) {
        int sum = reduceToSingle(day) + reduceToSingle(month) + reduceToSingle(year);
        return Math.floorMod(sum - 1, SOUL_CORRECTION_COUNT) + 1;
    }

    static SoulCorrection soulCorrection(int number) {
        return KabbalahTables.SOUL_CORRECTIONS.get(Math.floorMod(number - 1, SOUL_CORRECTION_COUNT));
    }

    /**
     * 字母数值：a..i = 1..9，j..r = 10..90，s..z = 100..800；非字母忽略。
     */
    static int nameValue(String name) {
        if (name == null) {
            return 0;
        }
        int total = 0;
        for (char c : name.toLowerCase(Locale.ROOT).toCharArray()) {
            if (c < 'a' || c > 'z') {
                continue;
            }
            int index = c - 'a';
            int unit = index % 9 + 1;
            int scale = index < 9 ? 1 : index < 18 ? 10 : 100;
            total += unit * scale;
        }
        return total;
    }

    static List<TreePosition> treePositions(int nameValue, int day, int month) {
        return KabbalahTables.SEPHIROT.stream()
                .map(s -> {
                    double seed = ((nameValue + day * s.position() + month) % 100) / 100.0;
                    double activation = Math.max(0.1, Math.min(1.0, seed));
                    return new TreePosition(s.name(), s.position(), activation, s.quality());
                })
                .collect(Collectors.toUnmodifiableList());
    }

    static String tikkunPath(SoulCorrection correction, Sephirah sephirah) {
        return "Your soul correction of " + correction.name()
                + " invites you through the gateway of " + sephirah.name() + " (" + sephirah.meaning() + "). "
                + "The work of your tikkun is " + correction.correction().toLowerCase(Locale.ROOT) + ".";
    }

    private static int reduceToSingle(int n) {
        int num = Math.abs(n);
        while (num > 9) {
            num = digitSum(num);
        }
        return num;
    }

    private static int digitSum(int n) {
        int sum = 0;
        for (int v = n; v > 0; v /= 10) {
            sum += v % 10;
        }
        return sum;
    }
}
