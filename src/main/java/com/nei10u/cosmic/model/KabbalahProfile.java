package com.nei10u.cosmic.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class KabbalahProfile {
    SoulCorrection soulCorrection;
    Sephirah birthSephirah;
    List<TreePosition> treeOfLifePositions;
    String tikkunPath;
}
