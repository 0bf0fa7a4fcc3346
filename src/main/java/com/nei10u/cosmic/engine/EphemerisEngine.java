package com.nei10u.cosmic.engine;

import com.nei10u.cosmic.config.EphemerisProperties;
import com.nei10u.cosmic.exception.RemoteEphemerisException;
import com.nei10u.cosmic.model.BirthData;
import com.nei10u.cosmic.model.EphemerisSource;
import com.nei10u.cosmic.model.NatalChart;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalTime;

/**
 * 星历入口：配置了远程服务时优先远程，失败一律回落本地级数，并以 LOCAL_FALLBACK 标明来源。
 */
@Service
@RequiredArgsConstructor
public class EphemerisEngine {

    private static final Logger log = LoggerFactory.getLogger(EphemerisEngine.class);

    /**
     * 远程回落事件专用 marker，便于按 marker 过滤或告警
     */
    public static final Marker FALLBACK_MARKER = MarkerFactory.getMarker("EPHEMERIS_FALLBACK");

    private final EphemerisProperties properties;
    private final LocalEphemeris localEphemeris;
    private final RemoteEphemerisClient remoteClient;

    public record ChartComputation(NatalChart chart, EphemerisSource source) {
    }

    public ChartComputation calculate(BirthData birth, String name, String requestId) {
        if (!properties.isRemoteConfigured()) {
            return new ChartComputation(localEphemeris.calculate(birth), EphemerisSource.LOCAL);
        }
        LocalTime calculationTime = localEphemeris.calculationTime(birth);
        try {
            NatalChart chart = remoteClient.fetchChart(birth, name, calculationTime);
            log.info("[{}] ephemeris served by remote provider", requestId);
            return new ChartComputation(chart, EphemerisSource.REMOTE);
        } catch (RemoteEphemerisException e) {
            log.warn(FALLBACK_MARKER, "[{}] remote ephemeris 失败，回落本地计算: {}", requestId, e.getMessage());
            return new ChartComputation(localEphemeris.calculate(birth), EphemerisSource.LOCAL_FALLBACK);
        }
    }
}
