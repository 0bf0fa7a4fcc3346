package com.nei10u.cosmic.engine;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.nei10u.cosmic.calc.TemporalMath;
import com.nei10u.cosmic.exception.RemoteEphemerisException;
import com.nei10u.cosmic.model.Aspect;
import com.nei10u.cosmic.model.AspectType;
import com.nei10u.cosmic.model.CelestialBody;
import com.nei10u.cosmic.model.NatalChart;
import com.nei10u.cosmic.model.PlanetaryPosition;
import org.springframework.util.StringUtils;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 远程星历报文解析。
 * <p>
 * 兼容两种形态：planets 为 name → 对象的映射，或带 name 字段的数组；houses 同理。
 * 缺少太阳或月亮、或出生时间已知却缺少 12 宫宫头时，视为报文不完整。
 */
final class RemoteChartParser {

    private static final String[] LONGITUDE_KEYS = {"longitude", "degree", "abs_pos", "absolute_degree"};

    private RemoteChartParser() {
    }

    static NatalChart parse(String raw, boolean timeKnown, LocalTime calculationTime) {
        try {
            return parsePayload(raw, timeKnown, calculationTime);
        } catch (JSONException | ClassCastException | IllegalArgumentException e) {
            throw new RemoteEphemerisException("remote ephemeris payload is malformed: " + e.getMessage(), e);
        }
    }

    private static NatalChart parsePayload(String raw, boolean timeKnown, LocalTime calculationTime) {
        if (!StringUtils.hasText(raw)) {
            throw new RemoteEphemerisException("remote ephemeris returned an empty body");
        }
        JSONObject root = JSON.parseObject(raw);
        if (root == null) {
            throw new RemoteEphemerisException("remote ephemeris payload is empty");
        }
        JSONObject data = root.containsKey("data") ? root.getJSONObject("data") : root;
        if (data == null) {
            throw new RemoteEphemerisException("remote ephemeris payload has no data");
        }

        Map<CelestialBody, JSONObject> planets = readPlanets(data.get("planets"));
        if (!planets.containsKey(CelestialBody.SUN) || !planets.containsKey(CelestialBody.MOON)) {
            throw new RemoteEphemerisException("remote ephemeris payload lacks Sun or Moon");
        }

        HouseCalculator.HouseCusps cusps = null;
        if (timeKnown) {
            cusps = readHouses(data);
            if (cusps == null) {
                throw new RemoteEphemerisException("remote ephemeris payload lacks house cusps");
            }
        }

        List<PlanetaryPosition> positions = new ArrayList<>();
        for (Map.Entry<CelestialBody, JSONObject> entry : planets.entrySet()) {
            JSONObject node = entry.getValue();
            Double longitude = readLongitude(node);
            if (longitude == null) {
                throw new RemoteEphemerisException("remote ephemeris payload lacks longitude for " + entry.getKey());
            }
            boolean retrograde = entry.getKey() == CelestialBody.NORTH_NODE
                    || node.getBooleanValue("is_retrograde")
                    || node.getBooleanValue("retrograde");
            Integer house = timeKnown ? node.getInteger("house") : null;
            if (house != null && (house < 1 || house > 12)) {
                // 越界的宫位号不信，改按宫头推算
                house = null;
            }
            positions.add(ChartAssembler.position(entry.getKey(), TemporalMath.normalizeDegrees(longitude),
                    retrograde, house, cusps));
        }

        List<Aspect> aspects = readAspects(data.getJSONArray("aspects"));
        if (aspects.isEmpty()) {
            aspects = AspectCalculator.calculate(positions);
        }
        return ChartAssembler.chart(positions, cusps, aspects, timeKnown, calculationTime);
    }

    private static Map<CelestialBody, JSONObject> readPlanets(Object planets) {
        Map<CelestialBody, JSONObject> result = new EnumMap<>(CelestialBody.class);
        if (planets instanceof JSONObject map) {
            for (String key : map.keySet()) {
                CelestialBody body = CelestialBody.fromName(key);
                JSONObject node = map.getJSONObject(key);
                if (body != null && node != null) {
                    result.put(body, node);
                }
            }
        } else if (planets instanceof JSONArray array) {
            for (int i = 0; i < array.size(); i++) {
                JSONObject node = array.getJSONObject(i);
                if (node == null) {
                    continue;
                }
                CelestialBody body = CelestialBody.fromName(node.getString("name"));
                if (body != null) {
                    result.put(body, node);
                }
            }
        }
        return result;
    }

    /**
     * 12 宫宫头齐全才算有效；上升、天顶优先取 angles，缺省用第 1、10 宫宫头。
     */
    private static HouseCalculator.HouseCusps readHouses(JSONObject data) {
        Double[] cusps = new Double[12];
        Object houses = data.get("houses");
        if (houses instanceof JSONArray array) {
            for (int i = 0; i < array.size(); i++) {
                Object item = array.get(i);
                if (item instanceof JSONObject node) {
                    Integer number = node.getInteger("house");
                    if (number == null) {
                        number = node.getInteger("number");
                    }
                    putCusp(cusps, number == null ? i + 1 : number, readLongitude(node));
                } else if (item instanceof Number n) {
                    putCusp(cusps, i + 1, n.doubleValue());
                }
            }
        } else if (houses instanceof JSONObject map) {
            for (String key : map.keySet()) {
                Integer number = parseHouseNumber(key);
                Object value = map.get(key);
                if (value instanceof JSONObject node) {
                    putCusp(cusps, number, readLongitude(node));
                } else if (value instanceof Number n) {
                    putCusp(cusps, number, n.doubleValue());
                }
            }
        }
        for (Double cusp : cusps) {
            if (cusp == null) {
                return null;
            }
        }

        JSONObject angles = data.getJSONObject("angles");
        Double asc = angles == null ? null : readAngle(angles, "Ascendant", "ascendant", "asc");
        Double mc = angles == null ? null : readAngle(angles, "Midheaven", "midheaven", "mc");
        List<Double> list = new ArrayList<>(12);
        Collections.addAll(list, cusps);
        return new HouseCalculator.HouseCusps(Collections.unmodifiableList(list),
                asc == null ? cusps[0] : TemporalMath.normalizeDegrees(asc),
                mc == null ? cusps[9] : TemporalMath.normalizeDegrees(mc),
                HouseCalculator.HouseSystem.PLACIDUS);
    }

    /**
     * 相位无向，同一对天体同一相位只保留报文里的第一条。
     */
    private static List<Aspect> readAspects(JSONArray array) {
        List<Aspect> aspects = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (array == null) {
            return aspects;
        }
        for (int i = 0; i < array.size(); i++) {
            JSONObject node = array.getJSONObject(i);
            if (node == null) {
                continue;
            }
            CelestialBody a = CelestialBody.fromName(firstText(node, "p1", "planet1", "body1"));
            CelestialBody b = CelestialBody.fromName(firstText(node, "p2", "planet2", "body2"));
            AspectType type = AspectType.fromName(firstText(node, "type", "aspect"));
            if (a == null || b == null || type == null || a == b) {
                continue;
            }
            CelestialBody first = a.compareTo(b) < 0 ? a : b;
            CelestialBody second = first == a ? b : a;
            if (!seen.add(first + "|" + second + "|" + type)) {
                continue;
            }
            aspects.add(new Aspect(first, second, type, Math.abs(node.getDoubleValue("orb"))));
        }
        return aspects;
    }

    private static void putCusp(Double[] cusps, Integer number, Double longitude) {
        if (number != null && number >= 1 && number <= 12 && longitude != null) {
            cusps[number - 1] = TemporalMath.normalizeDegrees(longitude);
        }
    }

    private static Integer parseHouseNumber(String key) {
        String digits = key.replaceAll("[^0-9]", "");
        if (digits.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double readAngle(JSONObject angles, String... keys) {
        for (String key : keys) {
            Object value = angles.get(key);
            if (value instanceof Number n) {
                return n.doubleValue();
            }
            if (value instanceof JSONObject node) {
                Double lon = readLongitude(node);
                if (lon != null) {
                    return lon;
                }
            }
        }
        return null;
    }

    private static Double readLongitude(JSONObject node) {
        for (String key : LONGITUDE_KEYS) {
            Double value = node.getDouble(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String firstText(JSONObject node, String... keys) {
        for (String key : keys) {
            String value = node.getString(key);
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }
}
