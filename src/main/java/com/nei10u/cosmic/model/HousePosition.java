package com.nei10u.cosmic.model;

import lombok.Value;

@Value
public class HousePosition {
    int number;
    double cuspLongitude;
    ZodiacSign sign;
}
