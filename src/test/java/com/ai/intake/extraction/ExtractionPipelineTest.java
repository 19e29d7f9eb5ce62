package com.ai.intake.extraction;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionPipelineTest {

    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.initialize();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void stopsAtFirstSuccess() {
        AtomicInteger laterCalls = new AtomicInteger();
        ExtractionPipeline<String> pipeline = new ExtractionPipeline<>("field", List.of(
                layer("first", false, t -> ExtractionResult.failed("miss")),
                layer("second", false, t -> ExtractionResult.success("value", "second")),
                layer("third", false, t -> {
                    laterCalls.incrementAndGet();
                    return ExtractionResult.success("other", "third");
                })), executor, Duration.ofSeconds(1));

        ExtractionResult<String> result = pipeline.run("input");

        assertThat(result.getValue()).isEqualTo("value");
        assertThat(result.getLayer()).isEqualTo("second");
        assertThat(laterCalls).hasValue(0);
    }

    @Test
    void throwingLayerBecomesFailure() {
        ExtractionPipeline<String> pipeline = new ExtractionPipeline<>("field", List.of(
                layer("broken", false, t -> {
                    throw new IllegalStateException("boom");
                }),
                layer("external_broken", true, t -> {
                    throw new IllegalStateException("boom");
                }),
                layer("ok", false, t -> ExtractionResult.success("value", "ok"))), executor, Duration.ofSeconds(1));

        assertThat(pipeline.run("input").getLayer()).isEqualTo("ok");
    }

    @Test
    void slowExternalLayerTimesOutAndFallsThrough() {
        ExtractionPipeline<String> pipeline = new ExtractionPipeline<>("field", List.of(
                layer("slow", true, t -> {
                    try {
                        Thread.sleep(5000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return ExtractionResult.success("late", "slow");
                }),
                layer("fast", true, t -> ExtractionResult.success("value", "fast"))), executor, Duration.ofMillis(100));

        long started = System.nanoTime();
        ExtractionResult<String> result = pipeline.run("input");
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertThat(result.getValue()).isEqualTo("value");
        assertThat(elapsedMs).isLessThan(2000);
    }

    @Test
    void allLayersFailingGivesFieldReason() {
        ExtractionPipeline<String> pipeline = new ExtractionPipeline<>("phone", List.of(
                layer("a", false, t -> ExtractionResult.failed("miss")),
                layer("b", false, t -> null)), executor, Duration.ofSeconds(1));

        ExtractionResult<String> result = pipeline.run("input");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReason()).isEqualTo("no_phone_found");
    }

    @Test
    void blankInputSkipsLayers() {
        AtomicInteger calls = new AtomicInteger();
        ExtractionPipeline<String> pipeline = new ExtractionPipeline<>("name", List.of(
                layer("a", false, t -> {
                    calls.incrementAndGet();
                    return ExtractionResult.success("x", "a");
                })), executor, Duration.ofSeconds(1));

        assertThat(pipeline.run("   ").getReason()).isEqualTo("empty_input");
        assertThat(pipeline.run(null).getReason()).isEqualTo("empty_input");
        assertThat(calls).hasValue(0);
    }

    @Test
    void rejectedExternalLayerFails() {
        executor.shutdown();
        ExtractionPipeline<String> pipeline = new ExtractionPipeline<>("name", List.of(
                layer("external", true, t -> ExtractionResult.success("x", "external"))), executor, Duration.ofSeconds(1));

        assertThat(pipeline.run("input").isSuccess()).isFalse();
    }

    private static ExtractionLayer<String> layer(String name, boolean external,
                                                 Function<String, ExtractionResult<String>> body) {
        return new ExtractionLayer<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ExtractionResult<String> extract(String transcript) {
                return body.apply(transcript);
            }

            @Override
            public boolean isExternal() {
                return external;
            }

            @Override
            public Optional<Duration> timeout() {
                return Optional.empty();
            }
        };
    }
}
