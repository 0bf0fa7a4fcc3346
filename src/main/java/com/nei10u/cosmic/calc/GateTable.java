package com.nei10u.cosmic.calc;

import com.nei10u.cosmic.model.Channel;
import com.nei10u.cosmic.model.HdCenter;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.nei10u.cosmic.model.HdCenter.AJNA;
import static com.nei10u.cosmic.model.HdCenter.G;
import static com.nei10u.cosmic.model.HdCenter.HEAD;
import static com.nei10u.cosmic.model.HdCenter.HEART;
import static com.nei10u.cosmic.model.HdCenter.ROOT;
import static com.nei10u.cosmic.model.HdCenter.SACRAL;
import static com.nei10u.cosmic.model.HdCenter.SOLAR_PLEXUS;
import static com.nei10u.cosmic.model.HdCenter.SPLEEN;
import static com.nei10u.cosmic.model.HdCenter.THROAT;

/**
 * 64 闸门轮序与 36 条通道表，均为固定常量。
 * <p>
 * 闸门轮从黄经 0° 起，每段 5.625°。
 */
public final class GateTable {

    public static final double GATE_SPAN = 360.0 / 64.0;

    private static final int[] GATE_ORDER = {
            41, 19, 13, 49, 30, 55, 37, 63, 22, 36, 25, 17, 21, 51, 42, 3,
            27, 24, 2, 23, 8, 20, 16, 35, 45, 12, 15, 52, 39, 53, 62, 56,
            31, 33, 7, 4, 29, 59, 40, 64, 47, 6, 46, 18, 48, 57, 32, 50,
            28, 44, 1, 43, 14, 34, 9, 5, 26, 11, 10, 58, 38, 54, 61, 60
    };

    public static final List<Channel> CHANNELS = List.of(
            // Head - Ajna
            new Channel(64, 47, HEAD, AJNA, "Abstraction"),
            new Channel(61, 24, HEAD, AJNA, "Awareness"),
            new Channel(63, 4, HEAD, AJNA, "Logic"),
            // Ajna - Throat
            new Channel(17, 62, AJNA, THROAT, "Acceptance"),
            new Channel(43, 23, AJNA, THROAT, "Structuring"),
            new Channel(11, 56, AJNA, THROAT, "Curiosity"),
            // Throat - G
            new Channel(31, 7, THROAT, G, "The Alpha"),
            new Channel(8, 1, THROAT, G, "Inspiration"),
            new Channel(33, 13, THROAT, G, "The Prodigal"),
            new Channel(10, 20, G, THROAT, "Awakening"),
            // Throat - motors / Spleen
            new Channel(20, 34, THROAT, SACRAL, "Charisma"),
            new Channel(20, 57, THROAT, SPLEEN, "The Brainwave"),
            new Channel(16, 48, THROAT, SPLEEN, "The Wavelength"),
            new Channel(12, 22, THROAT, SOLAR_PLEXUS, "Openness"),
            new Channel(35, 36, THROAT, SOLAR_PLEXUS, "Transitoriness"),
            new Channel(45, 21, THROAT, HEART, "Money"),
            // G
            new Channel(10, 34, G, SACRAL, "Exploration"),
            new Channel(10, 57, G, SPLEEN, "Perfected Form"),
            new Channel(15, 5, G, SACRAL, "Rhythm"),
            new Channel(46, 29, G, SACRAL, "Discovery"),
            new Channel(2, 14, G, SACRAL, "The Beat"),
            new Channel(25, 51, G, HEART, "Initiation"),
            // Heart
            new Channel(26, 44, HEART, SPLEEN, "Surrender"),
            new Channel(40, 37, HEART, SOLAR_PLEXUS, "Community"),
            // Sacral
            new Channel(59, 6, SACRAL, SOLAR_PLEXUS, "Intimacy"),
            new Channel(27, 50, SACRAL, SPLEEN, "Preservation"),
            new Channel(34, 57, SACRAL, SPLEEN, "Power"),
            new Channel(3, 60, SACRAL, ROOT, "Mutation"),
            new Channel(42, 53, SACRAL, ROOT, "Maturation"),
            new Channel(9, 52, SACRAL, ROOT, "Concentration"),
            // Spleen - Root
            new Channel(28, 38, SPLEEN, ROOT, "Struggle"),
            new Channel(18, 58, SPLEEN, ROOT, "Judgment"),
            new Channel(32, 54, SPLEEN, ROOT, "Transformation"),
            // Solar Plexus - Root
            new Channel(30, 41, SOLAR_PLEXUS, ROOT, "Recognition"),
            new Channel(55, 39, SOLAR_PLEXUS, ROOT, "Emoting"),
            new Channel(49, 19, SOLAR_PLEXUS, ROOT, "Synthesis")
    );

    private GateTable() {
    }

    public static int gateCount() {
        return GATE_ORDER.length;
    }

    /**
     * 按轮序取闸门，index 可为任意整数（按 64 取模）。
     */
    public static int gateAt(int index) {
        return GATE_ORDER[Math.floorMod(index, GATE_ORDER.length)];
    }

    public static int indexForLongitude(double longitude) {
        return (int) (TemporalMath.normalizeDegrees(longitude) / GATE_SPAN) % GATE_ORDER.length;
    }

    public static int gateForLongitude(double longitude) {
        return GATE_ORDER[indexForLongitude(longitude)];
    }

    public static List<Channel> channelsForGates(Set<Integer> gates) {
        return CHANNELS.stream()
                .filter(c -> c.isDefinedBy(gates))
                .collect(Collectors.toUnmodifiableList());
    }

    public static Set<HdCenter> centersOf(List<Channel> channels) {
        return channels.stream()
                .flatMap(c -> Stream.of(c.centerA(), c.centerB()))
                .collect(Collectors.toSet());
    }
}
