package com.bko.intervalcoach.advisory;

import com.bko.intervalcoach.shared.OracleSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Oracle-first dispatch with a deterministic fallback, shared by every advisory call site.
 * The oracle is asked with bounded retries and a per-attempt timeout and its reply is validated.
 * Any oracle failure yields the fallback instead of an exception.
 */
@Service
public class AdvisoryService implements DisposableBean {
    private static final Logger logger = LoggerFactory.getLogger(AdvisoryService.class);

    private final AdvisoryPort advisoryPort;
    private final OracleSettings settings;
    private final OracleResponseReader responseReader;
    private final ExecutorService executor;

    public AdvisoryService(AdvisoryPort advisoryPort, OracleSettings settings, ObjectMapper objectMapper) {
        this.advisoryPort = advisoryPort;
        this.settings = settings;
        this.responseReader = new OracleResponseReader(objectMapper);
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "advisory-oracle");
            thread.setDaemon(true);
            return thread;
        });
    }

    public <T> Advised<T> adviseOrFallback(AdvisoryPort.AdvisoryPrompt prompt,
                                           ResponseValidator<T> validator,
                                           Supplier<T> fallback) {
        Optional<T> advised = consult(prompt, validator);
        if (advised.isPresent()) {
            return Advised.fromOracle(advised.get());
        }
        return Advised.fallback(fallback.get());
    }

    /**
     * Asks the oracle and validates the reply; empty on any failure.
     */
    public <T> Optional<T> consult(AdvisoryPort.AdvisoryPrompt prompt, ResponseValidator<T> validator) {
        if (!isEnabled()) {
            logger.debug("Oracle disabled, skipping {}", prompt.purpose());
            return Optional.empty();
        }
        AdvisoryPort.AdvisoryReply reply;
        try {
            reply = settings.retry().execute(
                    "Oracle " + prompt.purpose(),
                    () -> askWithTimeout(prompt),
                    AdvisoryService::isRetryable);
        } catch (AdvisoryException | IOException e) {
            logger.warn("Oracle unavailable for {}: {}", prompt.purpose(), e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.warn("Oracle call for {} failed unexpectedly", prompt.purpose(), e);
            return Optional.empty();
        }

        Optional<JsonNode> response = responseReader.read(reply == null ? null : reply.text());
        if (response.isEmpty()) {
            logger.warn("Oracle reply for {} could not be parsed, using fallback", prompt.purpose());
            return Optional.empty();
        }
        try {
            Optional<T> value = validator.validate(response.get());
            if (value.isEmpty()) {
                logger.info("Oracle reply for {} contained nothing valid, using fallback", prompt.purpose());
            }
            return value;
        } catch (RuntimeException e) {
            logger.warn("Validating oracle reply for {} failed", prompt.purpose(), e);
            return Optional.empty();
        }
    }

    public boolean isEnabled() {
        return settings.enabled() && advisoryPort.isAvailable();
    }

    private AdvisoryPort.AdvisoryReply askWithTimeout(AdvisoryPort.AdvisoryPrompt prompt) {
        Future<AdvisoryPort.AdvisoryReply> future = executor.submit(() -> advisoryPort.ask(prompt));
        try {
            return future.get(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AdvisoryException("Oracle timed out after " + settings.timeout().toMillis() + " ms", e, false);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AdvisoryException("Interrupted while waiting for the oracle", e, false);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AdvisoryException advisoryException) {
                throw advisoryException;
            }
            throw new AdvisoryException("Oracle call failed: " + cause.getMessage(), cause, true);
        }
    }

    private static boolean isRetryable(Exception e) {
        return e instanceof AdvisoryException advisoryException && advisoryException.isRetryable();
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }
}
