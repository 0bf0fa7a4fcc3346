package com.nei10u.cosmic.service;

import com.nei10u.cosmic.config.EphemerisProperties;
import com.nei10u.cosmic.engine.EphemerisEngine;
import com.nei10u.cosmic.engine.GeneKeysEngine;
import com.nei10u.cosmic.engine.HumanDesignEngine;
import com.nei10u.cosmic.engine.KabbalahEngine;
import com.nei10u.cosmic.engine.LocalEphemeris;
import com.nei10u.cosmic.engine.NumerologyEngine;
import com.nei10u.cosmic.engine.RemoteEphemerisClient;
import com.nei10u.cosmic.exception.FingerprintBuildException;
import com.nei10u.cosmic.exception.InvalidBirthDataException;
import com.nei10u.cosmic.model.BirthData;
import com.nei10u.cosmic.model.CosmicFingerprint;
import com.nei10u.cosmic.model.EphemerisSource;
import com.nei10u.cosmic.model.HumanDesignType;
import com.nei10u.cosmic.model.ZodiacSign;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CosmicFingerprintBuilderTest {

    private ExecutorService executor;
    private EphemerisEngine ephemerisEngine;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(5);
        EphemerisProperties properties = new EphemerisProperties();
        ephemerisEngine = new EphemerisEngine(properties, new LocalEphemeris(properties),
                new RemoteEphemerisClient(HttpClient.newHttpClient(), properties));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private CosmicFingerprintBuilder builder(HumanDesignEngine humanDesignEngine, Duration timeout) {
        return new CosmicFingerprintBuilder(new BirthDataValidator(), ephemerisEngine, humanDesignEngine,
                new GeneKeysEngine(), new KabbalahEngine(), new NumerologyEngine(Fingerprints.CLOCK), new SynthesisComposer(),
                executor, Fingerprints.CLOCK, timeout);
    }

    private CosmicFingerprintBuilder builder() {
        return builder(new HumanDesignEngine(), Duration.ofSeconds(10));
    }

    @Nested
    @DisplayName("正常构建")
    class Success {

        @Test
        @DisplayName("五个体系齐全，本地星历，时间戳取自 Clock")
        void complete() {
            CosmicFingerprint fp = builder().build(Fingerprints.LONDON, "  John Smith ", "rid-1");

            assertThat(fp.getFullName()).isEqualTo("John Smith");
            assertThat(fp.getEphemerisSource()).isEqualTo(EphemerisSource.LOCAL);
            assertThat(fp.getNatalChart().getSunSign()).isEqualTo(ZodiacSign.PISCES);
            assertThat(fp.getNatalChart().getRisingSign()).contains(ZodiacSign.LEO);
            assertThat(fp.getHumanDesign().getType()).isEqualTo(HumanDesignType.REFLECTOR);
            assertThat(fp.getGeneKeys().getLifeWork().number()).isEqualTo(21);
            assertThat(fp.getKabbalah().getSoulCorrection().number()).isEqualTo(10);
            assertThat(fp.getNumerology().getLifePath().getValue()).isEqualTo(1);
            assertThat(fp.getSynthesis().getCoreThemes()).isNotEmpty();
            assertThat(fp.getGeneratedAt()).isEqualTo(Fingerprints.CLOCK.instant());
        }

        @Test
        @DisplayName("同样输入两次构建，除时间相关字段外完全相等，但不是同一实例")
        void deterministic() {
            CosmicFingerprintBuilder builder = builder();
            CosmicFingerprint first = builder.build(Fingerprints.LONDON, "John Smith", "rid-2");
            CosmicFingerprint second = builder.build(Fingerprints.LONDON, "John Smith", "rid-3");

            assertThat(second).isNotSameAs(first);
            assertThat(second).usingRecursiveComparison()
                    .ignoringFields("generatedAt", "numerology.personalYear")
                    .isEqualTo(first);
        }

        @Test
        @DisplayName("只有日期：按参考时刻计算，无上升、天顶、宫位")
        void dateOnly() {
            BirthData birth = BirthData.builder().date(LocalDate.of(1990, 3, 25)).build();

            CosmicFingerprint fp = builder().build(birth, "Jane Doe", "rid-4");

            assertThat(fp.getNatalChart().getSunSign()).isEqualTo(ZodiacSign.ARIES);
            assertThat(fp.getNatalChart().isTimeKnown()).isFalse();
            assertThat(fp.getNatalChart().getCalculationTime()).isEqualTo(LocalTime.NOON);
            assertThat(fp.getNatalChart().getRisingSign()).isEmpty();
            assertThat(fp.getNatalChart().getHouses()).isEmpty();
            assertThat(fp.getSynthesis().getCoreThemes()).noneMatch(t -> t.contains("Rising"));
        }

        @Test
        @DisplayName("1990-11-02 Test User：生命灵数 5，灵魂修正在 1..72 内，四个巅峰期")
        void testUser() {
            BirthData birth = BirthData.builder().date(LocalDate.of(1990, 11, 2)).build();

            CosmicFingerprint fp = builder().build(birth, "Test User", "rid-9");

            assertThat(fp.getNumerology().getLifePath().getValue()).isEqualTo(5);
            assertThat(fp.getKabbalah().getSoulCorrection().number()).isEqualTo(5).isBetween(1, 72);
            assertThat(fp.getNumerology().getPinnacles()).hasSize(4);
            assertThat(fp.getNumerology().getChallenges()).hasSizeGreaterThanOrEqualTo(3);
            assertThat(fp.getHumanDesign().getDefinedCenters().size() + fp.getHumanDesign().getUndefinedCenters().size())
                    .isEqualTo(9);
        }
    }

    @Nested
    @DisplayName("失败")
    class Failure {

        @Test
        @DisplayName("任一引擎抛错：整次失败并带上组件名")
        void engineFailure() {
            HumanDesignEngine broken = mock(HumanDesignEngine.class);
            when(broken.calculate(any())).thenThrow(new IllegalStateException("gate table corrupt"));

            assertThatThrownBy(() -> builder(broken, Duration.ofSeconds(10))
                    .build(Fingerprints.LONDON, "John Smith", "rid-5"))
                    .isInstanceOf(FingerprintBuildException.class)
                    .hasMessageContaining("gate table corrupt")
                    .hasRootCauseInstanceOf(IllegalStateException.class)
                    .satisfies(e -> assertThat(((FingerprintBuildException) e).getComponent())
                            .isEqualTo("human-design"));
        }

        @Test
        @DisplayName("超时：以 builder 组件失败")
        void timeout() {
            HumanDesignEngine slow = mock(HumanDesignEngine.class);
            when(slow.calculate(any())).thenAnswer(invocation -> {
                Thread.sleep(5_000);
                return null;
            });

            assertThatThrownBy(() -> builder(slow, Duration.ofMillis(200))
                    .build(Fingerprints.LONDON, "John Smith", "rid-6"))
                    .isInstanceOf(FingerprintBuildException.class)
                    .hasMessageContaining("timed out")
                    .satisfies(e -> assertThat(((FingerprintBuildException) e).getComponent())
                            .isEqualTo("builder"));
        }

        @Test
        @DisplayName("超时后中断仍在计算的线程")
        void timeoutInterruptsWorker() throws Exception {
            CountDownLatch interrupted = new CountDownLatch(1);
            HumanDesignEngine slow = mock(HumanDesignEngine.class);
            when(slow.calculate(any())).thenAnswer(invocation -> {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
                return null;
            });

            assertThatThrownBy(() -> builder(slow, Duration.ofMillis(200))
                    .build(Fingerprints.LONDON, "John Smith", "rid-10"))
                    .isInstanceOf(FingerprintBuildException.class);
            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        @DisplayName("校验不通过时不启动任何计算")
        void invalidInput() {
            HumanDesignEngine untouched = mock(HumanDesignEngine.class);

            assertThatThrownBy(() -> builder(untouched, Duration.ofSeconds(10))
                    .build(Fingerprints.DATE_ONLY, "李雷", "rid-7"))
                    .isInstanceOf(InvalidBirthDataException.class);
            assertThatThrownBy(() -> builder(untouched, Duration.ofSeconds(10))
                    .build(Fingerprints.LONDON.toBuilder().latitude(null).build(), "John Smith", "rid-8"))
                    .isInstanceOf(InvalidBirthDataException.class);
            verifyNoInteractions(untouched);
        }
    }
}
