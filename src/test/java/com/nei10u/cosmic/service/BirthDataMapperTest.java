package com.nei10u.cosmic.service;

import com.nei10u.cosmic.exception.InvalidBirthDataException;
import com.nei10u.cosmic.model.BirthData;
import com.nei10u.cosmic.model.FingerprintRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BirthDataMapperTest {

    private final BirthDataMapper mapper = new BirthDataMapper();

    private static FingerprintRequest request(int year, int month, int day) {
        FingerprintRequest req = new FingerprintRequest();
        req.setName("John Smith");
        req.setYear(year);
        req.setMonth(month);
        req.setDay(day);
        return req;
    }

    @Test
    @DisplayName("完整请求：时间、时区、坐标与出生地都带过去")
    void fullRequest() {
        FingerprintRequest req = request(1990, 3, 15);
        req.setHour(14);
        req.setMinute(30);
        req.setTimezone(" Europe/London ");
        req.setLatitude(51.5074);
        req.setLongitude(-0.1278);
        req.setCity(" London ");
        req.setCountryCode("GB");

        BirthData birth = mapper.toBirthData(req);

        assertThat(birth.getDate()).isEqualTo(LocalDate.of(1990, 3, 15));
        assertThat(birth.getTime()).contains(LocalTime.of(14, 30));
        assertThat(birth.getZone()).contains(ZoneId.of("Europe/London"));
        assertThat(birth.getLatitude()).contains(51.5074);
        assertThat(birth.getCity()).contains("London");
        assertThat(birth.getCountryCode()).contains("GB");
    }

    @Test
    @DisplayName("不给小时即时间未知，不补默认时刻")
    void dateOnly() {
        BirthData birth = mapper.toBirthData(request(1990, 3, 15));

        assertThat(birth.isTimeKnown()).isFalse();
        assertThat(birth.getZone()).isEmpty();
        assertThat(birth.getCity()).isEmpty();
    }

    @Test
    void hourWithoutMinute() {
        FingerprintRequest req = request(1990, 3, 15);
        req.setHour(9);

        assertThat(mapper.toBirthData(req).getTime()).contains(LocalTime.of(9, 0));
    }

    @Test
    @DisplayName("不存在的日期、时刻、时区都判为非法")
    void invalid() {
        assertThatThrownBy(() -> mapper.toBirthData(request(1990, 2, 30)))
                .isInstanceOf(InvalidBirthDataException.class)
                .hasMessageStartingWith("invalid birth date");

        FingerprintRequest badHour = request(1990, 3, 15);
        badHour.setHour(24);
        assertThatThrownBy(() -> mapper.toBirthData(badHour)).isInstanceOf(InvalidBirthDataException.class);

        FingerprintRequest minuteOnly = request(1990, 3, 15);
        minuteOnly.setMinute(15);
        assertThatThrownBy(() -> mapper.toBirthData(minuteOnly))
                .isInstanceOf(InvalidBirthDataException.class)
                .hasMessage("minute given without hour");

        FingerprintRequest badZone = request(1990, 3, 15);
        badZone.setTimezone("Mars/Olympus");
        assertThatThrownBy(() -> mapper.toBirthData(badZone))
                .isInstanceOf(InvalidBirthDataException.class)
                .hasMessageContaining("Mars/Olympus");
    }

    @Test
    @DisplayName("缺年份不当作公元 0 年，直接判为非法")
    void missingYear() {
        FingerprintRequest req = new FingerprintRequest();
        req.setMonth(3);
        req.setDay(25);

        assertThatThrownBy(() -> mapper.toBirthData(req))
                .isInstanceOf(InvalidBirthDataException.class)
                .hasMessage("birth year, month and day are required");
    }
}
