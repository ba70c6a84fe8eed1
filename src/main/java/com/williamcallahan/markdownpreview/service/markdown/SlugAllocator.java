package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.domain.markdown.Slug;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Hands out heading slugs that are unique within one render.
 *
 * <p>The first heading with a given slug keeps it; later ones get {@code -1}, {@code -2}, ...
 * appended. Suffixed slugs are recorded too, so a heading whose own text happens to equal an
 * earlier suffixed slug is disambiguated as well.</p>
 */
public final class SlugAllocator {

    private final Slugifier slugifier;
    private final Map<String, Integer> collisionCounts = new HashMap<>();

    public SlugAllocator(Slugifier slugifier) {
        this.slugifier = Objects.requireNonNull(slugifier, "Slugifier cannot be null");
    }

    /**
     * Allocates the anchor for a heading.
     *
     * @param headingText flattened heading text
     * @return slug not handed out before by this allocator
     */
    public Slug allocate(String headingText) {
        Slug slug = slugifier.fromHeading(headingText);
        Integer previousCount = collisionCounts.get(slug.value());
        if (previousCount == null) {
            collisionCounts.put(slug.value(), 0);
            return slug;
        }
        int count = previousCount;
        Slug suffixed;
        do {
            count++;
            suffixed = slugifier.fromHeading(slug.value() + "-" + count);
        } while (collisionCounts.containsKey(suffixed.value()));
        collisionCounts.put(slug.value(), count);
        collisionCounts.put(suffixed.value(), 0);
        return suffixed;
    }
}
