package com.nei10u.cosmic.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class NumerologyNumber {

    public enum Kind {
        LIFE_PATH("Life Path"),
        EXPRESSION("Expression"),
        SOUL_URGE("Soul Urge"),
        PERSONALITY("Personality"),
        BIRTHDAY("Birthday");

        private final String displayName;

        Kind(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }

        @Override
        public String toString() {
            return displayName;
        }
    }

    Kind kind;
    int value;
    boolean masterNumber;
    String meaning;
    List<String> keywords;
}
