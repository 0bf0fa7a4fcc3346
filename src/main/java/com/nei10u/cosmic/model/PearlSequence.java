package com.nei10u.cosmic.model;

public record PearlSequence(GeneKey vocation, GeneKey culture, GeneKey brand, GeneKey pearl) {
}
