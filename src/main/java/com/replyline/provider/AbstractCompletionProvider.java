package com.replyline.provider;

import com.replyline.config.ReplylineProperties;
import com.replyline.exception.CompletionProviderException;
import com.replyline.model.StreamRequest;
import com.replyline.model.TokenDelta;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Abstract base class for streaming providers with common functionality.
 */
@Slf4j
public abstract class AbstractCompletionProvider implements CompletionProvider {

    protected static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    protected final WebClient webClient;
    protected final ReplylineProperties properties;
    protected final ReplylineProperties.ProviderConfig config;

    protected AbstractCompletionProvider(
            WebClient webClient,
            ReplylineProperties properties,
            String providerName) {
        this.webClient = webClient;
        this.properties = properties;
        this.config = properties.getProviders().get(providerName);
    }

    @Override
    public boolean isEnabled() {
        return config != null && config.isEnabled();
    }

    @Override
    public Flux<TokenDelta> streamCompletion(StreamRequest request) {
        if (!isEnabled()) {
            return Flux.error(new CompletionProviderException(
                    CompletionProviderException.NO_PROVIDER, getName() + " provider is not enabled"));
        }

        log.info("Streaming request to {}: model={}, agent={}", getName(), request.getModel(), request.getAgentId());
        return executeWithRetry(Flux.defer(() -> openStream(request)));
    }

    /**
     * Open the provider's token stream.
     */
    protected abstract Flux<TokenDelta> openStream(StreamRequest request);

    /**
     * Retry connection-level failures, but only until the first token has been emitted.
     */
    protected Flux<TokenDelta> executeWithRetry(Flux<TokenDelta> stream) {
        AtomicBoolean emitted = new AtomicBoolean();

        return stream
                .doOnNext(delta -> emitted.set(true))
                .retryWhen(Retry.backoff(properties.getProxy().getMaxRetries(), Duration.ofSeconds(1))
                        .maxBackoff(Duration.ofSeconds(10))
                        .filter(error -> !emitted.get() && isRetryable(error))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .onErrorMap(error -> !(error instanceof CompletionProviderException),
                        error -> new CompletionProviderException(CompletionProviderException.PROVIDER_ERROR,
                                getName() + " stream failed: " + error.getMessage(), error))
                .doOnComplete(() -> log.debug("Stream completed for provider: {}", getName()))
                .doOnError(error -> log.error("Stream failed for provider {}: {}", getName(), error.getMessage()));
    }

    /**
     * Check if an error is retryable.
     */
    protected boolean isRetryable(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null) {
            return false;
        }

        return message.contains("timeout") ||
                message.contains("connection") ||
                message.contains("500") ||
                message.contains("502") ||
                message.contains("503") ||
                message.contains("504");
    }
}
