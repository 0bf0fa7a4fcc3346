package com.nei10u.cosmic.engine;

import com.nei10u.cosmic.calc.GateTable;
import com.nei10u.cosmic.calc.TemporalMath;
import com.nei10u.cosmic.model.BirthData;
import com.nei10u.cosmic.model.Channel;
import com.nei10u.cosmic.model.HdAuthority;
import com.nei10u.cosmic.model.HdCenter;
import com.nei10u.cosmic.model.HumanDesignProfile;
import com.nei10u.cosmic.model.HumanDesignType;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 人类图：人格（出生日）与设计（出生前 88 天）两组闸门 → 通道 → 中心 → 类型 / 权威 / 人生角色。
 * <p>
 * 太阳黄经用年内日序近似，只取日期，与出生时刻无关。
 */
@Service
public class HumanDesignEngine {

    static final int DESIGN_OFFSET_DAYS = 88;

    public HumanDesignProfile calculate(BirthData birth) {
        LocalDate date = birth.getDate();
        List<Integer> personality = gatesFor(date);
        List<Integer> design = gatesFor(date.minusDays(DESIGN_OFFSET_DAYS));

        Set<Integer> active = new TreeSet<>(personality);
        active.addAll(design);

        List<Channel> channels = GateTable.channelsForGates(active);
        EnumSet<HdCenter> defined = EnumSet.noneOf(HdCenter.class);
        defined.addAll(GateTable.centersOf(channels));
        EnumSet<HdCenter> undefined = EnumSet.complementOf(defined);

        HumanDesignType type = determineType(defined);
        return HumanDesignProfile.builder()
                .type(type)
                .strategy(type.getStrategy())
                .authority(determineAuthority(defined))
                .profile(profile(date))
                .personalityGates(personality)
                .designGates(design)
                .activeGates(List.copyOf(active))
                .definedChannels(channels)
                .definedCenters(List.copyOf(defined))
                .undefinedCenters(List.copyOf(undefined))
                .typeDescription(type.getDescription())
                .build();
    }

    /**
     * 太阳闸门、地球闸门（对冲 32 格）以及四个按月日取模的补充闸门，去重保序。
     */
    static List<Integer> gatesFor(LocalDate date) {
        int month = date.getMonthValue();
        int day = date.getDayOfMonth();
        double sunLongitude = TemporalMath.dayOfYear(date) / 365.25 * 360.0;
        int sunIndex = GateTable.indexForLongitude(sunLongitude);

        Set<Integer> gates = new LinkedHashSet<>();
        gates.add(GateTable.gateAt(sunIndex));
        gates.add(GateTable.gateAt(sunIndex + 32));
        gates.add(GateTable.gateAt(month * 5 + day));
        gates.add(GateTable.gateAt(month * 3 + day * 2));
        gates.add(GateTable.gateAt(day * 7));
        gates.add(GateTable.gateAt(month * 7 + day * 3));
        return List.copyOf(gates);
    }

    static HumanDesignType determineType(Set<HdCenter> defined) {
        boolean sacral = defined.contains(HdCenter.SACRAL);
        boolean motorToThroat = defined.contains(HdCenter.THROAT)
                && (defined.contains(HdCenter.HEART)
                || defined.contains(HdCenter.SOLAR_PLEXUS)
                || defined.contains(HdCenter.ROOT));
        if (sacral && motorToThroat) {
            return HumanDesignType.MANIFESTING_GENERATOR;
        }
        if (sacral) {
            return HumanDesignType.GENERATOR;
        }
        if (motorToThroat) {
            return HumanDesignType.MANIFESTOR;
        }
        if (defined.size() >= 2) {
            return HumanDesignType.PROJECTOR;
        }
        return HumanDesignType.REFLECTOR;
    }

    static HdAuthority determineAuthority(Set<HdCenter> defined) {
        for (HdAuthority authority : HdAuthority.values()) {
            if (authority.getCenter() != null && defined.contains(authority.getCenter())) {
                return authority;
            }
        }
        return HdAuthority.OUTER;
    }

    /**
     * 人格线 / 设计线，各取 1..6。
     */
    static String profile(LocalDate date) {
        int day = date.getDayOfMonth();
        int month = date.getMonthValue();
        int personalityLine = (day + month) % 6 + 1;
        int designLine = (day * 2 + month) % 6 + 1;
        return personalityLine + "/" + designLine;
    }
}
