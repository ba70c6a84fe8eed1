package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.domain.markdown.TokenType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered middleware chains per token type.
 *
 * <p>Each type starts from its base rule ({@link TokenRenderer}'s default rule when one exists,
 * otherwise the generic tag renderer). Middleware registered later wraps middleware registered
 * earlier, so the last registration runs first.</p>
 */
public final class RenderRuleRegistry {

    private final Map<TokenType, RenderRule> baseRules = new EnumMap<>(TokenType.class);
    private final Map<TokenType, List<RenderMiddleware>> middleware = new EnumMap<>(TokenType.class);
    private final Map<TokenType, RenderRule> composed = new EnumMap<>(TokenType.class);

    /**
     * Replaces the base rule of a token type. Registered middleware keeps wrapping it.
     *
     * @param type token type
     * @param rule new base rule
     */
    public void setBaseRule(TokenType type, RenderRule rule) {
        baseRules.put(Objects.requireNonNull(type, "Token type cannot be null"),
            Objects.requireNonNull(rule, "Render rule cannot be null"));
        composed.remove(type);
    }

    /**
     * Adds middleware to the chain of a token type.
     *
     * @param type token type
     * @param step middleware, outermost from now on
     * @return this registry
     */
    public RenderRuleRegistry use(TokenType type, RenderMiddleware step) {
        Objects.requireNonNull(type, "Token type cannot be null");
        Objects.requireNonNull(step, "Middleware cannot be null");
        middleware.computeIfAbsent(type, ignored -> new ArrayList<>()).add(step);
        composed.remove(type);
        return this;
    }

    /**
     * Returns the composed rule for a type.
     *
     * @param type token type
     * @return rule running the full middleware chain
     */
    public RenderRule ruleFor(TokenType type) {
        return composed.computeIfAbsent(type, this::compose);
    }

    /**
     * Copies the registry so that further registrations on the copy do not affect this one.
     *
     * @return independent copy
     */
    public RenderRuleRegistry copy() {
        RenderRuleRegistry copy = new RenderRuleRegistry();
        copy.baseRules.putAll(baseRules);
        middleware.forEach((type, steps) -> copy.middleware.put(type, new ArrayList<>(steps)));
        return copy;
    }

    private RenderRule compose(TokenType type) {
        RenderRule rule = baseRules.getOrDefault(type,
            (tokens, index, context, renderer) -> renderer.renderToken(tokens, index));
        for (RenderMiddleware step : middleware.getOrDefault(type, List.of())) {
            RenderRule next = rule;
            rule = (tokens, index, context, renderer) -> step.render(tokens, index, context, renderer, next);
        }
        return rule;
    }
}
