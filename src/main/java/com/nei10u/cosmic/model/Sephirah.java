package com.nei10u.cosmic.model;

/**
 * 生命之树上的质点，position 为 1（Keter）到 10（Malkhut）。
 */
public record Sephirah(String name, String hebrewName, String meaning, String quality, int position) {
}
