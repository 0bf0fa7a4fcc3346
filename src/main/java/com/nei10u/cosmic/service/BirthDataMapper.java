package com.nei10u.cosmic.service;

import com.nei10u.cosmic.exception.InvalidBirthDataException;
import com.nei10u.cosmic.model.BirthData;
import com.nei10u.cosmic.model.FingerprintRequest;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * 请求体 → {@link BirthData}。只做类型转换，不存在的日期、时刻或时区直接判为非法。
 */
@Component
public class BirthDataMapper {

    public BirthData toBirthData(FingerprintRequest req) {
        if (req.getYear() == null || req.getMonth() == null || req.getDay() == null) {
            throw new InvalidBirthDataException("birth year, month and day are required");
        }
        LocalDate date;
        try {
            date = LocalDate.of(req.getYear(), req.getMonth(), req.getDay());
        } catch (DateTimeException e) {
            throw new InvalidBirthDataException("invalid birth date: " + e.getMessage(), e);
        }

        LocalTime time = null;
        if (req.getHour() != null) {
            int minute = req.getMinute() == null ? 0 : req.getMinute();
            try {
                time = LocalTime.of(req.getHour(), minute);
            } catch (DateTimeException e) {
                throw new InvalidBirthDataException("invalid birth time: " + e.getMessage(), e);
            }
        } else if (req.getMinute() != null) {
            throw new InvalidBirthDataException("minute given without hour");
        }

        ZoneId zone = null;
        if (StringUtils.hasText(req.getTimezone())) {
            try {
                zone = ZoneId.of(req.getTimezone().trim());
            } catch (DateTimeException e) {
                throw new InvalidBirthDataException("unknown timezone: " + req.getTimezone(), e);
            }
        }

        return BirthData.builder()
                .date(date)
                .time(time)
                .zone(zone)
                .latitude(req.getLatitude())
                .longitude(req.getLongitude())
                .city(StringUtils.hasText(req.getCity()) ? req.getCity().trim() : null)
                .countryCode(StringUtils.hasText(req.getCountryCode()) ? req.getCountryCode().trim() : null)
                .build();
    }
}
