package com.nei10u.cosmic.service;

import com.nei10u.cosmic.exception.InvalidBirthDataException;
import com.nei10u.cosmic.model.BirthData;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 构建前的入参校验，任何一项不合法立即抛 {@link InvalidBirthDataException}。
 */
@Component
public class BirthDataValidator {

    public void validate(BirthData birth, String fullName) {
        if (birth == null || birth.getDate() == null) {
            throw new InvalidBirthDataException("birth date is required");
        }
        if (!StringUtils.hasText(fullName)) {
            throw new InvalidBirthDataException("full name is required");
        }
        if (!fullName.chars().anyMatch(c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'))) {
            throw new InvalidBirthDataException("full name must contain at least one Latin letter");
        }
        birth.getLatitude().ifPresent(lat -> {
            if (lat.isNaN() || lat < -90.0 || lat > 90.0) {
                throw new InvalidBirthDataException("latitude out of range [-90, 90]: " + lat);
            }
        });
        birth.getLongitude().ifPresent(lon -> {
            if (lon.isNaN() || lon < -180.0 || lon > 180.0) {
                throw new InvalidBirthDataException("longitude out of range [-180, 180]: " + lon);
            }
        });
        // 宫位需要经纬度
        if (birth.isTimeKnown() && !birth.hasCoordinates()) {
            throw new InvalidBirthDataException("latitude and longitude are required when birth time is known");
        }
    }
}
