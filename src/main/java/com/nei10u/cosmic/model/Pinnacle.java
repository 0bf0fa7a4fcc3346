package com.nei10u.cosmic.model;

/**
 * 人生巅峰期。endAge 为 null 表示最后一期，持续到终身。
 */
public record Pinnacle(int period, int number, String meaning, int startAge, Integer endAge) {

    public boolean isOpenEnded() {
        return endAge == null;
    }
}
