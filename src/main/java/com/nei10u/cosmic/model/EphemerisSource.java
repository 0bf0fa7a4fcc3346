package com.nei10u.cosmic.model;

/**
 * 星盘数据来源。LOCAL_FALLBACK 表示远程星历失败后改用本地级数计算。
 */
public enum EphemerisSource {
    REMOTE,
    LOCAL,
    LOCAL_FALLBACK
}
