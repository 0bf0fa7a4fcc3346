package com.nei10u.cosmic.model;

import java.util.Set;

/**
 * 通道：两个闸门同时激活即定义，并定义两端中心。
 */
public record Channel(int gateA, int gateB, HdCenter centerA, HdCenter centerB, String name) {

    public boolean isDefinedBy(Set<Integer> activeGates) {
        return activeGates.contains(gateA) && activeGates.contains(gateB);
    }

    public String label() {
        return gateA + "-" + gateB + " " + name;
    }
}
