package com.nei10u.cosmic.model;

public record SoulCorrection(int number, String name, String description, String challenge, String correction) {
}
