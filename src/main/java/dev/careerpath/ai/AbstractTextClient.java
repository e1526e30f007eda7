package dev.careerpath.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.careerpath.config.AiConfig;
import dev.careerpath.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.concurrent.TimeoutException;

/**
 * Common plumbing for provider clients: throttling, per-call timeout, failure classification,
 * retries of transient failures and metrics. Subclasses only build and send the request.
 */
@Slf4j
public abstract class AbstractTextClient implements TextGenerationClient {

    protected final AiConfig aiConfig;
    protected final PipelineMetrics metrics;
    protected final ObjectMapper objectMapper;
    private final CallThrottle throttle;

    protected AbstractTextClient(AiConfig aiConfig, PipelineMetrics metrics, ObjectMapper objectMapper) {
        this.aiConfig = aiConfig;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.throttle = new CallThrottle(aiConfig.getConcurrencyLimit(), aiConfig.getMinInterval());
    }

    /**
     * Send one request to the provider.
     *
     * @return Mono with the response text, empty if the provider returned no content
     */
    protected abstract Mono<String> call(String prompt, GenerationOptions options);

    /**
     * Model used when the caller does not pick one.
     */
    protected abstract String defaultModel();

    @Override
    public Mono<String> generate(String prompt, GenerationOptions options) {
        if (!isEnabled()) {
            return Mono.error(new ExternalServiceException(ExternalServiceException.Kind.AUTH_ERROR,
                    getName() + " API key is missing"));
        }
        GenerationOptions resolved = resolve(options);

        return throttle.submit(() -> timedCall(prompt, resolved))
                .retryWhen(Retry.backoff(aiConfig.getMaxRetries(), aiConfig.getRetryBackoff())
                        .filter(this::isRetryableError)
                        .doBeforeRetry(retrySignal -> log.info("Retrying {} call after {} (Attempt {})",
                                getName(), kindOf(retrySignal.failure()), retrySignal.totalRetries() + 1))
                        .onRetryExhaustedThrow((spec, retrySignal) -> retrySignal.failure()));
    }

    @Override
    public Mono<JsonNode> generateJson(String prompt, GenerationOptions options) {
        GenerationOptions jsonOptions = (options == null ? GenerationOptions.defaults() : options).toBuilder()
                .responseFormat(ResponseFormat.JSON)
                .build();
        return generate(prompt, jsonOptions)
                .flatMap(text -> {
                    try {
                        return Mono.just(JsonResponseParser.parse(objectMapper, text));
                    } catch (ExternalServiceException e) {
                        metrics.recordApiError(getName(), e.getKind().name());
                        log.debug("{} returned unparseable JSON: {}", getName(), text);
                        return Mono.error(e);
                    }
                });
    }

    private Mono<String> timedCall(String prompt, GenerationOptions options) {
        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            metrics.recordApiCall(getName());
            return call(prompt, options)
                    .timeout(options.timeout())
                    .onErrorMap(this::classify)
                    .filter(text -> !text.isBlank())
                    .switchIfEmpty(Mono.error(new ExternalServiceException(
                            ExternalServiceException.Kind.MALFORMED_RESPONSE, getName() + " returned no content")))
                    .doOnError(e -> {
                        ExternalServiceException failure = (ExternalServiceException) e;
                        metrics.recordApiError(getName(), failure.getKind().name());
                        log.debug("{} call failed ({}): {}", getName(), failure.getKind(), failure.getMessage());
                    })
                    .doOnTerminate(() -> metrics.recordApiLatency(getName(), System.currentTimeMillis() - start));
        });
    }

    private GenerationOptions resolve(GenerationOptions options) {
        GenerationOptions given = options == null ? GenerationOptions.defaults() : options;
        return GenerationOptions.builder()
                .model(given.model() != null ? given.model() : defaultModel())
                .maxTokens(given.maxTokens() != null ? given.maxTokens() : aiConfig.getDefaultMaxTokens())
                .temperature(given.temperature() != null ? given.temperature() : aiConfig.getDefaultTemperature())
                .responseFormat(given.responseFormat() != null ? given.responseFormat() : ResponseFormat.TEXT)
                .timeout(given.timeout() != null ? given.timeout() : aiConfig.getDefaultTimeout())
                .build();
    }

    /**
     * Map transport and HTTP failures onto the provider-neutral failure kinds.
     */
    protected ExternalServiceException classify(Throwable e) {
        if (e instanceof ExternalServiceException) {
            return (ExternalServiceException) e;
        }
        if (e instanceof TimeoutException) {
            return new ExternalServiceException(ExternalServiceException.Kind.TIMEOUT,
                    getName() + " call timed out", e);
        }
        if (e instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) e;
            int status = response.getStatusCode().value();
            log.debug("{} error body: {}", getName(), response.getResponseBodyAsString());
            if (status == 401 || status == 403) {
                return new ExternalServiceException(ExternalServiceException.Kind.AUTH_ERROR,
                        getName() + " rejected credentials (" + status + ")", e);
            }
            if (status == 429) {
                return new ExternalServiceException(ExternalServiceException.Kind.RATE_LIMITED,
                        getName() + " rate limit reached", e);
            }
            return new ExternalServiceException(ExternalServiceException.Kind.PROVIDER_ERROR,
                    getName() + " returned status " + status, e, status >= 500);
        }
        if (e instanceof WebClientRequestException) {
            return new ExternalServiceException(ExternalServiceException.Kind.PROVIDER_ERROR,
                    getName() + " connection failed", e);
        }
        if (e instanceof CodecException) {
            return new ExternalServiceException(ExternalServiceException.Kind.MALFORMED_RESPONSE,
                    getName() + " response could not be decoded", e);
        }
        return new ExternalServiceException(ExternalServiceException.Kind.PROVIDER_ERROR,
                getName() + " call failed: " + e.getMessage(), e, false);
    }

    private boolean isRetryableError(Throwable e) {
        return e instanceof ExternalServiceException && ((ExternalServiceException) e).isRetryable();
    }

    private String kindOf(Throwable e) {
        return e instanceof ExternalServiceException ? ((ExternalServiceException) e).getKind().name() : "error";
    }
}
