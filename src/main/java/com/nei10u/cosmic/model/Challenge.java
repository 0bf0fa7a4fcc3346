package com.nei10u.cosmic.model;

/**
 * 挑战数，0 到 8；0 是“所有挑战之挑战”，不是错误值。
 */
public record Challenge(int period, int number, String meaning) {
}
