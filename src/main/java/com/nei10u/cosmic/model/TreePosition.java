package com.nei10u.cosmic.model;

/**
 * 某个质点的激活度，取值 [0.1, 1.0]。
 */
public record TreePosition(String sephirahName, int position, double activation, String description) {
}
