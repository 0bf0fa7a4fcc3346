package com.nei10u.cosmic.model;

import lombok.Data;

@Data
public class FingerprintRequest {
    private String requestId;
    private String name;         // 全名，数字学与卡巴拉都用它
    private Integer year;        // 年月日必填，缺省不补 0
    private Integer month;
    private Integer day;
    private Integer hour;        // 不填表示出生时间未知
    private Integer minute;
    private String timezone;     // IANA 时区，如 Asia/Shanghai；不填按 UT
    private Double latitude;     // 出生时间已知时必填，用于宫位
    private Double longitude;
    private String city;         // 出生地，远程星历用
    private String countryCode;
}
