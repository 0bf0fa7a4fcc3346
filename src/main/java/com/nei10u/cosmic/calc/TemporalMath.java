package com.nei10u.cosmic.calc;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 儒略日、角度归一化等基础换算。纯函数，不做日期合法性校验。
 */
public final class TemporalMath {

    public static final double J2000 = 2451545.0;
    public static final double DAYS_PER_CENTURY = 36525.0;

    private TemporalMath() {
    }

    /**
     * 格里高利历儒略日。day 可带小数（时分折算成日的小数部分）。
     */
    public static double julianDay(int year, int month, double day) {
        int y = year;
        int m = month;
        if (m <= 2) {
            y -= 1;
            m += 12;
        }
        int a = Math.floorDiv(y, 100);
        int b = 2 - a + Math.floorDiv(a, 4);
        return Math.floor(365.25 * (y + 4716)) + Math.floor(30.6001 * (m + 1)) + day + b - 1524.5;
    }

    /**
     * @param utc 世界时
     */
    public static double julianDay(LocalDateTime utc) {
        double day = utc.getDayOfMonth()
                + utc.getHour() / 24.0
                + utc.getMinute() / 1440.0
                + utc.getSecond() / 86400.0;
        return julianDay(utc.getYear(), utc.getMonthValue(), day);
    }

    /**
     * 自 J2000.0 起的儒略世纪数。
     */
    public static double julianCenturies(double jd) {
        return (jd - J2000) / DAYS_PER_CENTURY;
    }

    public static double normalizeDegrees(double degrees) {
        double r = degrees % 360.0;
        if (r < 0) {
            r += 360.0;
        }
        // -1e-15 + 360 在双精度下等于 360
        return r >= 360.0 ? 0.0 : r;
    }

    public static double toRadians(double degrees) {
        return degrees * Math.PI / 180.0;
    }

    public static double toDegrees(double radians) {
        return radians * 180.0 / Math.PI;
    }

    public static double sinDeg(double degrees) {
        return Math.sin(toRadians(degrees));
    }

    public static double cosDeg(double degrees) {
        return Math.cos(toRadians(degrees));
    }

    public static double tanDeg(double degrees) {
        return Math.tan(toRadians(degrees));
    }

    /**
     * atan2 结果换成 [0,360) 的角度。
     */
    public static double atan2Deg(double y, double x) {
        return normalizeDegrees(toDegrees(Math.atan2(y, x)));
    }

    /**
     * 两个黄经之间的最小夹角，[0,180]。
     */
    public static double separation(double a, double b) {
        double diff = Math.abs(normalizeDegrees(a) - normalizeDegrees(b));
        return diff > 180.0 ? 360.0 - diff : diff;
    }

    public static int dayOfYear(LocalDate date) {
        return date.getDayOfYear();
    }
}
