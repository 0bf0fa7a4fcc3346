package com.nei10u.cosmic.engine;

import com.alibaba.fastjson2.JSONObject;
import com.nei10u.cosmic.config.EphemerisProperties;
import com.nei10u.cosmic.exception.RemoteEphemerisException;
import com.nei10u.cosmic.model.BirthData;
import com.nei10u.cosmic.model.NatalChart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.LocalTime;

/**
 * 第三方星历接口客户端。单次请求、不重试，任何失败都以 {@link RemoteEphemerisException} 抛出，
 * 由 {@link EphemerisEngine} 决定是否回落本地计算。
 */
@Component
public class RemoteEphemerisClient {

    private static final Logger log = LoggerFactory.getLogger(RemoteEphemerisClient.class);

    private final HttpClient httpClient;
    private final EphemerisProperties properties;

    public RemoteEphemerisClient(HttpClient httpClient, EphemerisProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    /**
     * @param name            报文 subject.name，可为空
     * @param calculationTime 出生时间；未知时为参考时刻
     */
    public NatalChart fetchChart(BirthData birth, String name, LocalTime calculationTime) {
        EphemerisProperties.Remote remote = properties.getRemote();
        String body = buildPayload(birth, name, calculationTime, remote.getHouseSystem()).toJSONString();

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(stripTrailingSlash(remote.getBaseUrl()) + remote.getPath()))
                .timeout(remote.getTimeout())
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (StringUtils.hasText(remote.getApiKey())) {
            builder.header(remote.getApiKeyHeader(), remote.getApiKey());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new RemoteEphemerisException("remote ephemeris timed out after " + remote.getTimeout(), e);
        } catch (IOException e) {
            throw new RemoteEphemerisException("remote ephemeris unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteEphemerisException("remote ephemeris call interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new RemoteEphemerisException("remote ephemeris returned HTTP " + status);
        }
        log.debug("remote ephemeris raw: {}", abbreviate(response.body()));
        return RemoteChartParser.parse(response.body(), birth.isTimeKnown(), calculationTime);
    }

    static JSONObject buildPayload(BirthData birth, String name, LocalTime calculationTime, String houseSystem) {
        JSONObject subject = new JSONObject();
        subject.put("name", name == null ? "" : name);
        subject.put("year", birth.getDate().getYear());
        subject.put("month", birth.getDate().getMonthValue());
        subject.put("day", birth.getDate().getDayOfMonth());
        subject.put("hour", calculationTime.getHour());
        subject.put("minute", calculationTime.getMinute());
        birth.getCity().ifPresent(city -> subject.put("city", city));
        birth.getCountryCode().ifPresent(nation -> subject.put("nation", nation));
        birth.getLatitude().ifPresent(lat -> subject.put("latitude", lat));
        birth.getLongitude().ifPresent(lon -> subject.put("longitude", lon));
        birth.getZone().ifPresent(zone -> subject.put("timezone", zone.getId()));

        JSONObject payload = new JSONObject();
        payload.put("subject", subject);
        payload.put("house_system", houseSystem);
        payload.put("include_interpretation", false);
        return payload;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String abbreviate(String raw) {
        if (raw == null) {
            return "";
        }
        String clean = raw.replaceAll("\\s+", " ");
        return clean.length() > 200 ? clean.substring(0, 200) + "..." : clean;
    }
}
