package com.williamcallahan.markdownpreview.support;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class ContentHasherTest {

    private final ContentHasher hasher = new ContentHasher();

    @Test
    void sha256_matchesKnownDigest() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", hasher.sha256("abc"));
    }

    @Test
    void imageId_isStablePerSource() {
        assertEquals(hasher.imageId("img.png"), hasher.imageId("img.png"));
        assertNotEquals(hasher.imageId("img.png"), hasher.imageId("img2.png"));
        assertEquals("image-hash-" + hasher.sha256("img.png"), hasher.imageId("img.png"));
    }
}
