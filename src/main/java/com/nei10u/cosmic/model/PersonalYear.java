package com.nei10u.cosmic.model;

/**
 * 个人年数随日历年变化，calendarYear 记录它是按哪一年算出来的。
 */
public record PersonalYear(int value, String theme, int calendarYear) {
}
