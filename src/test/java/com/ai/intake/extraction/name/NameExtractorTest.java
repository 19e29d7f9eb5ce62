package com.ai.intake.extraction.name;

import com.ai.intake.client.EntityRecognizer;
import com.ai.intake.client.LlmClient;
import com.ai.intake.config.IntakeProperties;
import com.ai.intake.extraction.ExtractionResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

class NameExtractorTest {

    private EntityRecognizer recognizer;
    private LlmClient llm;
    private ThreadPoolTaskExecutor executor;
    private IntakeProperties properties;

    @BeforeEach
    void setUp() {
        recognizer = Mockito.mock(EntityRecognizer.class);
        llm = Mockito.mock(LlmClient.class);
        when(llm.complete(anyString(), anyString())).thenReturn(Optional.empty());
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.initialize();
        properties = new IntakeProperties();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private NameExtractor extractor() {
        return new NameExtractor(properties, recognizer, llm, executor);
    }

    @Test
    void introductionPattern() {
        ExtractionResult<String> result = extractor().extract("My name is Johnny Walker");

        assertThat(result.getValue()).isEqualTo("Johnny Walker");
        assertThat(result.getLayer()).isEqualTo("pattern");
    }

    @Test
    void fillersAndTrailingWordsAreDropped() {
        assertThat(extractor().extract("Um, hi, this is sarah o'connor calling about an appointment").getValue())
                .isEqualTo("Sarah O'Connor");
        assertThat(extractor().extract("uh my name's, uh, john smith").getValue())
                .isEqualTo("John Smith");
    }

    @Test
    void partialWordsAreSkipped() {
        assertThat(extractor().extract("I'm J- John Smith").getValue()).isEqualTo("John Smith");
    }

    @Test
    void bareTwoWordAnswer() {
        assertThat(extractor().extract("mary-jane watson").getValue()).isEqualTo("Mary-Jane Watson");
    }

    @Test
    void timePhrasesAreNotNames() {
        assertThat(extractor().extract("Thursday morning").isSuccess()).isFalse();
        assertThat(extractor().extract("book tomorrow").isSuccess()).isFalse();
        assertThat(NameTokens.isDenied("April Jones")).isFalse();
    }

    @Test
    void fillerOnlyUtteranceFails() {
        ExtractionResult<String> result = extractor().extract("uh, yes, hello");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReason()).isEqualTo("no_name_found");
    }

    @Test
    void deniedLlmGuessIsNeverReturned() {
        when(llm.complete(anyString(), anyString())).thenReturn(Optional.of("Um"));

        ExtractionResult<String> result = extractor().extract("the one who called yesterday");

        assertThat(result.isSuccess()).isFalse();
    }

    @Test
    void nerTimeoutFallsThroughToLlmWithinBudget() {
        properties.getNer().setTimeout(Duration.ofMillis(100));
        when(recognizer.isEnabled()).thenReturn(true);
        when(recognizer.findPersons(anyString())).thenAnswer(inv -> {
            Thread.sleep(3000);
            return List.of("Johnny Walker");
        });
        when(llm.complete(anyString(), anyString())).thenReturn(Optional.of("Johnny Walker"));

        long started = System.nanoTime();
        ExtractionResult<String> result = extractor().extract("the caller johnny walker speaking about something");
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertThat(result.getValue()).isEqualTo("Johnny Walker");
        assertThat(result.getLayer()).isEqualTo("llm");
        assertThat(elapsedMs).isLessThan(1500);
    }

    @Test
    void nerLayerUsedWhenPatternsMiss() {
        when(recognizer.isEnabled()).thenReturn(true);
        when(recognizer.findPersons(anyString())).thenReturn(List.of("Priya Patel"));

        ExtractionResult<String> result = extractor().extract("the caller priya patel about a visit");

        assertThat(result.getValue()).isEqualTo("Priya Patel");
        assertThat(result.getLayer()).isEqualTo("ner");
    }

    @Test
    void denylistCoversFillerAndStopWords() {
        assertThat(NameTokens.isDenied("Um")).isTrue();
        assertThat(NameTokens.isDenied("my name")).isTrue();
        assertThat(NameTokens.isDenied("J-")).isTrue();
        assertThat(NameTokens.isDenied("Johnny Walker")).isFalse();
    }
}
