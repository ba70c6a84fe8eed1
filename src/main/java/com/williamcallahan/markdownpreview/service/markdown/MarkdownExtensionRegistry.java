package com.williamcallahan.markdownpreview.service.markdown;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of preview extensions.
 *
 * <p>Extensions are applied in registration order, each to a copy of the adapter produced by
 * the ones before it. A failing extension is skipped: the adapter it was given is discarded,
 * the failure is logged and reported, and the remaining extensions still load.</p>
 */
@Component
public class MarkdownExtensionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownExtensionRegistry.class);

    private final List<TokenTransform> transforms = new ArrayList<>();

    public MarkdownExtensionRegistry() {
    }

    /**
     * Registers every {@link TokenTransform} bean, in {@code @Order} order.
     *
     * @param transformBeans transform beans in the application context
     */
    @Autowired
    public MarkdownExtensionRegistry(ObjectProvider<TokenTransform> transformBeans) {
        transformBeans.orderedStream().forEach(this::register);
    }

    public void register(TokenTransform transform) {
        transforms.add(Objects.requireNonNull(transform, "Transform cannot be null"));
    }

    public List<TokenTransform> transforms() {
        return List.copyOf(transforms);
    }

    /**
     * Folds the registered extensions over an adapter.
     *
     * @param adapter base adapter; never modified
     * @return the resulting adapter and any load failures
     */
    public ExtensionApplication applyTo(MarkdownParserAdapter adapter) {
        MarkdownParserAdapter current = Objects.requireNonNull(adapter, "Adapter cannot be null");
        List<ExtensionLoadFailure> failures = new ArrayList<>();
        for (TokenTransform transform : transforms) {
            String name = transform.name();
            try {
                MarkdownParserAdapter result = transform.apply(current.copy());
                if (result == null) {
                    logger.warn("Markdown extension {} returned no adapter, skipping it", name);
                    failures.add(new ExtensionLoadFailure(name, "Extension returned no adapter", null));
                    continue;
                }
                current = result;
                logger.debug("Loaded markdown extension {}", name);
            } catch (RuntimeException | LinkageError e) {
                logger.warn("Markdown extension {} failed to load, skipping it: {}", name, e.getMessage(), e);
                failures.add(new ExtensionLoadFailure(name, e.getMessage(), e));
            }
        }
        return new ExtensionApplication(current, failures);
    }
}
