package com.nei10u.cosmic.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Optional;

/**
 * 出生数据。出生时间未知时 time 为空，不用任何默认时刻代替。
 * <p>
 * 未给出时区时，出生时间按 UT 处理。
 */
@Value
@Builder(toBuilder = true)
public class BirthData {
    LocalDate date;
    LocalTime time;
    ZoneId zone;
    Double latitude;
    Double longitude;
    String city;        // 仅远程星历使用
    String countryCode; // ISO 国家代码，仅远程星历使用

    public Optional<LocalTime> getTime() {
        return Optional.ofNullable(time);
    }

    public Optional<ZoneId> getZone() {
        return Optional.ofNullable(zone);
    }

    public Optional<Double> getLatitude() {
        return Optional.ofNullable(latitude);
    }

    public Optional<Double> getLongitude() {
        return Optional.ofNullable(longitude);
    }

    public Optional<String> getCity() {
        return Optional.ofNullable(city);
    }

    public Optional<String> getCountryCode() {
        return Optional.ofNullable(countryCode);
    }

    public boolean isTimeKnown() {
        return time != null;
    }

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
