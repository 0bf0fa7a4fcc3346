package com.nei10u.cosmic.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class HumanDesignProfile {
    HumanDesignType type;
    String strategy;
    HdAuthority authority;
    String profile;              // "人格线/设计线"，如 "3/5"
    List<Integer> personalityGates;
    List<Integer> designGates;
    List<Integer> activeGates;   // 两组闸门并集，升序
    List<Channel> definedChannels;
    List<HdCenter> definedCenters;
    List<HdCenter> undefinedCenters;
    String typeDescription;
}
