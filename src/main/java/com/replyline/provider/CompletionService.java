package com.replyline.provider;

import com.replyline.config.ReplylineProperties;
import com.replyline.exception.CompletionProviderException;
import com.replyline.model.StreamRequest;
import com.replyline.model.TokenDelta;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Routes completion requests to the provider for the requested model.
 * Every call runs through the calling agent's circuit breaker, so a failing
 * agent fails fast instead of piling up upstream requests.
 */
@Slf4j
@Service
public class CompletionService {

    private static final String BREAKER_PREFIX = "completion-";

    private final List<CompletionProvider> providers;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final ReplylineProperties properties;

    public CompletionService(
            List<CompletionProvider> providers,
            CircuitBreakerRegistry circuitBreakerRegistry,
            ReplylineProperties properties) {
        this.providers = providers;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.properties = properties;
        log.info("Initialized CompletionService with {} providers: {}",
                providers.size(),
                providers.stream().map(CompletionProvider::getName).toList());
    }

    /**
     * Stream a completion from the first enabled provider supporting the model.
     */
    public Flux<TokenDelta> streamCompletion(StreamRequest request) {
        String model = request.getModel();

        CompletionProvider provider = providers.stream()
                .filter(CompletionProvider::isEnabled)
                .filter(p -> p.supports(model))
                .findFirst()
                .orElse(null);

        if (provider == null) {
            log.error("No enabled provider found for model: {}", model);
            return Flux.error(new CompletionProviderException(CompletionProviderException.NO_PROVIDER,
                    "No provider available for model: " + model +
                    ". Enabled providers: " +
                    providers.stream()
                            .filter(CompletionProvider::isEnabled)
                            .map(CompletionProvider::getName)
                            .toList()));
        }

        log.debug("Routing model '{}' to provider '{}'", model, provider.getName());

        Flux<TokenDelta> stream = Flux.defer(() -> provider.streamCompletion(request));
        if (!properties.getCircuitBreaker().isEnabled()) {
            return stream;
        }

        CircuitBreaker circuitBreaker = circuitBreaker(request.getAgentId());
        return stream
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .onErrorMap(CallNotPermittedException.class, e -> new CompletionProviderException(
                        CompletionProviderException.CIRCUIT_OPEN,
                        "Circuit open for agent " + request.getAgentId() + ", try again later", e));
    }

    /**
     * Circuit breaker guarding an agent's completions.
     */
    public CircuitBreaker circuitBreaker(String agentId) {
        return circuitBreakerRegistry.circuitBreaker(BREAKER_PREFIX + agentId);
    }

    public List<CompletionProvider> getProviders() {
        return providers;
    }
}
