package com.nei10u.cosmic.service;

import com.nei10u.cosmic.engine.EphemerisEngine;
import com.nei10u.cosmic.engine.GeneKeysEngine;
import com.nei10u.cosmic.engine.HumanDesignEngine;
import com.nei10u.cosmic.engine.KabbalahEngine;
import com.nei10u.cosmic.engine.NumerologyEngine;
import com.nei10u.cosmic.exception.FingerprintBuildException;
import com.nei10u.cosmic.model.BirthData;
import com.nei10u.cosmic.model.CosmicFingerprint;
import com.nei10u.cosmic.model.GeneKeysProfile;
import com.nei10u.cosmic.model.HumanDesignProfile;
import com.nei10u.cosmic.model.KabbalahProfile;
import com.nei10u.cosmic.model.NumerologyProfile;
import com.nei10u.cosmic.model.Synthesis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 宇宙指纹构建：五个引擎并发计算，全部完成后再合成。
 * <p>
 * 任一引擎失败则整次构建失败，抛 {@link FingerprintBuildException}，不返回残缺结果。
 * 失败或超时后中断其余仍在跑的线程。
 * 每次构建都返回新的不可变实例，不缓存、不共享。
 */
@Service
public class CosmicFingerprintBuilder {

    private static final Logger log = LoggerFactory.getLogger(CosmicFingerprintBuilder.class);

    private final BirthDataValidator validator;
    private final EphemerisEngine ephemerisEngine;
    private final HumanDesignEngine humanDesignEngine;
    private final GeneKeysEngine geneKeysEngine;
    private final KabbalahEngine kabbalahEngine;
    private final NumerologyEngine numerologyEngine;
    private final SynthesisComposer synthesisComposer;
    private final ExecutorService executor;
    private final Clock clock;
    private final Duration timeout;

    public CosmicFingerprintBuilder(BirthDataValidator validator,
                                    EphemerisEngine ephemerisEngine,
                                    HumanDesignEngine humanDesignEngine,
                                    GeneKeysEngine geneKeysEngine,
                                    KabbalahEngine kabbalahEngine,
                                    NumerologyEngine numerologyEngine,
                                    SynthesisComposer synthesisComposer,
                                    @Qualifier("fingerprintExecutor") ExecutorService executor,
                                    Clock clock,
                                    @Value("${cosmic.fingerprint.timeout:30s}") Duration timeout) {
        this.validator = validator;
        this.ephemerisEngine = ephemerisEngine;
        this.humanDesignEngine = humanDesignEngine;
        this.geneKeysEngine = geneKeysEngine;
        this.kabbalahEngine = kabbalahEngine;
        this.numerologyEngine = numerologyEngine;
        this.synthesisComposer = synthesisComposer;
        this.executor = executor;
        this.clock = clock;
        this.timeout = timeout;
    }

    public CosmicFingerprint build(BirthData birth, String fullName, String requestId) {
        validator.validate(birth, fullName);
        String name = fullName.trim();
        log.info("[{}] fingerprint build start: date={} timeKnown={}", requestId, birth.getDate(), birth.isTimeKnown());

        List<Future<?>> workers = new ArrayList<>(5);
        CompletableFuture<EphemerisEngine.ChartComputation> chartTask =
                submit("ephemeris", () -> ephemerisEngine.calculate(birth, name, requestId), workers);
        CompletableFuture<HumanDesignProfile> hdTask =
                submit("human-design", () -> humanDesignEngine.calculate(birth), workers);
        CompletableFuture<GeneKeysProfile> geneKeysTask =
                submit("gene-keys", () -> geneKeysEngine.calculate(birth), workers);
        CompletableFuture<KabbalahProfile> kabbalahTask =
                submit("kabbalah", () -> kabbalahEngine.calculate(birth, name), workers);
        CompletableFuture<NumerologyProfile> numerologyTask =
                submit("numerology", () -> numerologyEngine.calculate(birth, name), workers);

        CompletableFuture<Void> all =
                CompletableFuture.allOf(chartTask, hdTask, geneKeysTask, kabbalahTask, numerologyTask);
        try {
            all.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            interruptAll(workers);
            throw unwrap(e.getCause(), requestId);
        } catch (TimeoutException e) {
            interruptAll(workers);
            log.error("[{}] fingerprint build timed out after {}", requestId, timeout);
            throw new FingerprintBuildException("builder", "fingerprint build timed out after " + timeout, e);
        } catch (InterruptedException e) {
            interruptAll(workers);
            Thread.currentThread().interrupt();
            throw new FingerprintBuildException("builder", "fingerprint build interrupted", e);
        }

        EphemerisEngine.ChartComputation chart = chartTask.join();
        HumanDesignProfile hd = hdTask.join();
        GeneKeysProfile geneKeys = geneKeysTask.join();
        KabbalahProfile kabbalah = kabbalahTask.join();
        NumerologyProfile numerology = numerologyTask.join();

        Synthesis synthesis;
        try {
            synthesis = synthesisComposer.compose(chart.chart(), hd, kabbalah, numerology);
        } catch (RuntimeException e) {
            log.error("[{}] synthesis 失败: {}", requestId, e.getMessage(), e);
            throw new FingerprintBuildException("synthesis", "synthesis failed", e);
        }

        CosmicFingerprint fp = CosmicFingerprint.builder()
                .birthData(birth)
                .fullName(name)
                .natalChart(chart.chart())
                .ephemerisSource(chart.source())
                .humanDesign(hd)
                .geneKeys(geneKeys)
                .kabbalah(kabbalah)
                .numerology(numerology)
                .synthesis(synthesis)
                .generatedAt(Instant.now(clock))
                .build();
        log.info("[{}] fingerprint build done: sun={} hd={} lifePath={} source={}", requestId,
                fp.getNatalChart().getSunSign(), hd.getType(), numerology.getLifePath().getValue(), chart.source());
        return fp;
    }

    /**
     * 结果走 CompletableFuture，线程句柄另存一份：CompletableFuture.cancel 不会中断执行线程。
     */
    private <T> CompletableFuture<T> submit(String component, Supplier<T> task, List<Future<?>> workers) {
        CompletableFuture<T> result = new CompletableFuture<>();
        workers.add(executor.submit(() -> {
            try {
                result.complete(task.get());
            } catch (FingerprintBuildException e) {
                result.completeExceptionally(e);
            } catch (RuntimeException e) {
                result.completeExceptionally(new FingerprintBuildException(component,
                        component + " calculation failed: " + e.getMessage(), e));
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        }));
        return result;
    }

    private static FingerprintBuildException unwrap(Throwable failure, String requestId) {
        Throwable cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof FingerprintBuildException fbe) {
            log.error("[{}] {} 失败: {}", requestId, fbe.getComponent(), fbe.getMessage(), fbe);
            return fbe;
        }
        log.error("[{}] fingerprint build 失败: {}", requestId, cause == null ? "unknown" : cause.getMessage(), cause);
        return new FingerprintBuildException("builder", "fingerprint build failed", cause);
    }

    private static void interruptAll(List<Future<?>> workers) {
        for (Future<?> worker : workers) {
            worker.cancel(true);
        }
    }
}
