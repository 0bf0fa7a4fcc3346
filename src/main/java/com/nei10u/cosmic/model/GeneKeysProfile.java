package com.nei10u.cosmic.model;

import lombok.Builder;
import lombok.Value;

/**
 * 激活序列四键（人格太阳/地球、设计太阳/地球）加珍珠序列。
 */
@Value
@Builder
public class GeneKeysProfile {
    GeneKey lifeWork;
    GeneKey evolution;
    GeneKey radiance;
    GeneKey purpose;
    PearlSequence pearlSequence;
}
