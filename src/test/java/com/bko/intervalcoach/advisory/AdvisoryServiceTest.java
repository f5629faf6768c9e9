package com.bko.intervalcoach.advisory;

import com.bko.intervalcoach.shared.OracleSettings;
import com.bko.intervalcoach.shared.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AdvisoryServiceTest {
    private static final AdvisoryPort.AdvisoryPrompt PROMPT = new AdvisoryPort.AdvisoryPrompt("test", "pick a number");
    private static final ResponseValidator<Integer> VALUE_FIELD =
            response -> Optional.ofNullable(OracleResponseReader.integer(response, "value"));

    @Test
    void disabledOracleUsesFallbackWithoutCallingThePort() {
        AdvisoryPort port = mock(AdvisoryPort.class);
        when(port.isAvailable()).thenReturn(true);
        AdvisoryService service = new AdvisoryService(port, OracleSettings.DISABLED, new ObjectMapper());

        Advised<Integer> advised = service.adviseOrFallback(PROMPT, VALUE_FIELD, () -> 7);

        assertEquals(7, advised.value());
        assertFalse(advised.isFromOracle());
        verify(port, never()).ask(any());
    }

    @Test
    void unavailablePortUsesFallback() {
        AdvisoryPort port = mock(AdvisoryPort.class);
        when(port.isAvailable()).thenReturn(false);
        AdvisoryService service = new AdvisoryService(port, enabled(1), new ObjectMapper());

        assertEquals(AdvisorySource.FALLBACK, service.adviseOrFallback(PROMPT, VALUE_FIELD, () -> 7).source());
        verify(port, never()).ask(any());
    }

    @Test
    void validReplyIsReturnedAsOracleValue() {
        AdvisoryPort port = availablePort();
        when(port.ask(PROMPT)).thenReturn(new AdvisoryPort.AdvisoryReply("model", "```json\n{\"value\": 4}\n```"));
        AdvisoryService service = new AdvisoryService(port, enabled(3), new ObjectMapper());

        Advised<Integer> advised = service.adviseOrFallback(PROMPT, VALUE_FIELD, () -> 7);

        assertEquals(4, advised.value());
        assertTrue(advised.isFromOracle());
    }

    @Test
    void retryableFailuresAreRetriedBeforeSucceeding() {
        AdvisoryPort port = availablePort();
        when(port.ask(PROMPT))
                .thenThrow(new AdvisoryException("503", true))
                .thenReturn(new AdvisoryPort.AdvisoryReply("model", "{\"value\": 2}"));
        AdvisoryService service = new AdvisoryService(port, enabled(3), new ObjectMapper());

        assertEquals(Optional.of(2), service.consult(PROMPT, VALUE_FIELD));
        verify(port, times(2)).ask(PROMPT);
    }

    @Test
    void nonRetryableFailureFallsBackAfterOneAttempt() {
        AdvisoryPort port = availablePort();
        when(port.ask(PROMPT)).thenThrow(new AdvisoryException("400 invalid key", false));
        AdvisoryService service = new AdvisoryService(port, enabled(3), new ObjectMapper());

        Advised<Integer> advised = service.adviseOrFallback(PROMPT, VALUE_FIELD, () -> 7);

        assertEquals(7, advised.value());
        verify(port, times(1)).ask(PROMPT);
    }

    @Test
    void unexpectedExceptionsAreRetriedThenFallBack() {
        AdvisoryPort port = availablePort();
        when(port.ask(PROMPT)).thenThrow(new IllegalStateException("socket closed"));
        AdvisoryService service = new AdvisoryService(port, enabled(2), new ObjectMapper());

        assertEquals(Optional.empty(), service.consult(PROMPT, VALUE_FIELD));
        verify(port, times(2)).ask(PROMPT);
    }

    @Test
    void malformedOrNonConformingReplyFallsBack() {
        AdvisoryPort port = availablePort();
        when(port.ask(PROMPT))
                .thenReturn(new AdvisoryPort.AdvisoryReply("model", "Sure! Here is my answer: 4"))
                .thenReturn(new AdvisoryPort.AdvisoryReply("model", "{\"value\": \"four\"}"));
        AdvisoryService service = new AdvisoryService(port, enabled(1), new ObjectMapper());

        assertEquals(Optional.empty(), service.consult(PROMPT, VALUE_FIELD));
        assertEquals(Optional.empty(), service.consult(PROMPT, VALUE_FIELD));
    }

    @Test
    void validatorExceptionFallsBack() {
        AdvisoryPort port = availablePort();
        when(port.ask(PROMPT)).thenReturn(new AdvisoryPort.AdvisoryReply("model", "{\"value\": 1}"));
        AdvisoryService service = new AdvisoryService(port, enabled(1), new ObjectMapper());

        Advised<Integer> advised = service.adviseOrFallback(PROMPT, response -> {
            throw new IllegalStateException("boom");
        }, () -> 7);

        assertEquals(7, advised.value());
    }

    @Test
    void slowOracleTimesOutWithoutRetrying() {
        AdvisoryPort port = availablePort();
        when(port.ask(PROMPT)).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return new AdvisoryPort.AdvisoryReply("model", "{\"value\": 1}");
        });
        OracleSettings settings = new OracleSettings(true, Duration.ofMillis(100), RetryPolicy.withoutBackoff(3));
        AdvisoryService service = new AdvisoryService(port, settings, new ObjectMapper());

        Advised<Integer> advised = service.adviseOrFallback(PROMPT, VALUE_FIELD, () -> 7);

        assertEquals(7, advised.value());
        assertFalse(advised.isFromOracle());
        verify(port, times(1)).ask(PROMPT);
        service.destroy();
    }

    @Test
    void timedOutOracleCallIsInterrupted() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        AdvisoryPort port = availablePort();
        when(port.ask(PROMPT)).thenAnswer(invocation -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return new AdvisoryPort.AdvisoryReply("model", "{\"value\": 1}");
        });
        OracleSettings settings = new OracleSettings(true, Duration.ofMillis(100), RetryPolicy.withoutBackoff(1));
        AdvisoryService service = new AdvisoryService(port, settings, new ObjectMapper());

        Advised<Integer> advised = service.adviseOrFallback(PROMPT, VALUE_FIELD, () -> 7);

        assertEquals(7, advised.value());
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
        service.destroy();
    }

    private static AdvisoryPort availablePort() {
        AdvisoryPort port = mock(AdvisoryPort.class);
        when(port.isAvailable()).thenReturn(true);
        return port;
    }

    private static OracleSettings enabled(int attempts) {
        return new OracleSettings(true, Duration.ofSeconds(5), RetryPolicy.withoutBackoff(attempts));
    }
}
