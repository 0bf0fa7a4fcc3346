package com.nei10u.cosmic.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 宇宙指纹：一次构建的不可变结果。重新生成会得到新实例，不做原地更新。
 * <p>
 * 同一份出生数据与姓名多次构建，除 generatedAt 与 numerology.personalYear 外各字段相等。
 */
@Value
@Builder
public class CosmicFingerprint {
    BirthData birthData;
    String fullName;
    NatalChart natalChart;
    EphemerisSource ephemerisSource;
    HumanDesignProfile humanDesign;
    GeneKeysProfile geneKeys;
    KabbalahProfile kabbalah;
    NumerologyProfile numerology;
    Synthesis synthesis;
    Instant generatedAt;
}
