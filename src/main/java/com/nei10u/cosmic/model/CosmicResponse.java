package com.nei10u.cosmic.model;

import lombok.Data;

/**
 * /api/cosmic 各接口共用的响应体，每个接口只填自己那部分。
 */
@Data
public class CosmicResponse {
    private String requestId;
    private CosmicFingerprint fingerprint;
    private String context;
    private String reading;
    private Boolean readingFallback;
    private LifePurposeProfile lifePurpose;
}
