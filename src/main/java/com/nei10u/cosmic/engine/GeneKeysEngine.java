package com.nei10u.cosmic.engine;

import com.nei10u.cosmic.calc.GateTable;
import com.nei10u.cosmic.calc.TemporalMath;
import com.nei10u.cosmic.model.BirthData;
import com.nei10u.cosmic.model.GeneKey;
import com.nei10u.cosmic.model.GeneKeysProfile;
import com.nei10u.cosmic.model.PearlSequence;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * 基因天命：与人类图共用闸门轮。
 * <p>
 * 生命志业 / 进化 = 出生日太阳 / 地球闸门，光芒 / 目的 = 设计日（前 88 天）太阳 / 地球闸门。
 * 珍珠序列四键按月日线性组合在轮序上取模。
 */
@Service
public class GeneKeysEngine {

    public GeneKeysProfile calculate(BirthData birth) {
        LocalDate date = birth.getDate();
        double sun = sunLongitude(date);
        double designSun = sunLongitude(date.minusDays(HumanDesignEngine.DESIGN_OFFSET_DAYS));

        return GeneKeysProfile.builder()
                .lifeWork(GeneKeysTables.key(GateTable.gateForLongitude(sun)))
                .evolution(GeneKeysTables.key(GateTable.gateForLongitude(sun + 180.0)))
                .radiance(GeneKeysTables.key(GateTable.gateForLongitude(designSun)))
                .purpose(GeneKeysTables.key(GateTable.gateForLongitude(designSun + 180.0)))
                .pearlSequence(pearlSequence(date.getMonthValue(), date.getDayOfMonth()))
                .build();
    }

    static PearlSequence pearlSequence(int month, int day) {
        return new PearlSequence(
                keyAt(month * 7 + day * 3),
                keyAt(month * 11 + day * 5),
                keyAt(month * 13 + day * 7),
                keyAt(month * 17 + day * 11));
    }

    private static GeneKey keyAt(int wheelIndex) {
        return GeneKeysTables.key(GateTable.gateAt(wheelIndex));
    }

    private static double sunLongitude(LocalDate date) {
        return TemporalMath.dayOfYear(date) / 365.25 * 360.0;
    }
}
