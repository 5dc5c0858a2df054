package com.replyline.provider;

import com.replyline.model.StreamRequest;
import com.replyline.model.TokenDelta;
import reactor.core.publisher.Flux;

/**
 * Interface for streaming completion providers.
 * Implementations handle provider-specific authentication, request mapping
 * and the wire format of the token stream.
 */
public interface CompletionProvider {

    /**
     * Get provider name (e.g., "openai", "anthropic").
     *
     * @return provider name
     */
    String getName();

    /**
     * Check if this provider supports the given model.
     *
     * @param model model name
     * @return true if supported
     */
    boolean supports(String model);

    /**
     * Check if provider is enabled and configured.
     *
     * @return true if ready to use
     */
    boolean isEnabled();

    /**
     * Stream a completion token by token.
     * The flux is lazy and finite; cancelling it stops the upstream request.
     *
     * @param request prompt and routing information
     * @return token deltas in order
     */
    Flux<TokenDelta> streamCompletion(StreamRequest request);
}
