package com.nei10u.cosmic.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 四套体系的综合解读（确定性模板，不依赖 AI）。
 */
@Value
@Builder
public class Synthesis {
    String lifePurpose;
    List<String> coreThemes;
    String superpower;
    String shadow;
    String invitation;
}
