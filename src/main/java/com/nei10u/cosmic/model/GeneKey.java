package com.nei10u.cosmic.model;

/**
 * 基因天命：同号闸门的阴影 → 天赋 → 悉地三层频率。
 */
public record GeneKey(int number, String shadow, String gift, String siddhi, String theme, String codonRing) {
}
