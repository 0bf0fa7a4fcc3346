package com.nei10u.cosmic.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class NumerologyProfile {
    NumerologyNumber lifePath;
    NumerologyNumber expression;
    NumerologyNumber soulUrge;
    NumerologyNumber personality;
    NumerologyNumber birthday;
    PersonalYear personalYear;
    List<Pinnacle> pinnacles;
    List<Challenge> challenges;
}
