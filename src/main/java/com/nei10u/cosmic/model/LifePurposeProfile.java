package com.nei10u.cosmic.model;

import lombok.Data;

@Data
public class LifePurposeProfile {
    private String headline;            // 一句话使命
    private String purposeDirection;    // 北交点 + 太阳：灵魂方向
    private String careerAlignment;     // 天顶 + 太阳：事业方向
    private String leadershipStyle;     // 太阳 + 土星：领导风格
    private String fulfillmentDrivers;  // 北交点 vs 南交点：满足感来源
    private String longTermPath;        // 土星：长期功课
    private SourceData sourceData;
    private boolean fallback;           // true 表示 AI 不可用，使用模板兜底

    @Data
    public static class SourceData {
        private String sunSign;
        private Integer sunHouse;
        private String northNodeSign;
        private Integer northNodeHouse;
        private String southNodeSign;
        private String midheavenSign;
        private String saturnSign;
        private Integer saturnHouse;
    }
}
