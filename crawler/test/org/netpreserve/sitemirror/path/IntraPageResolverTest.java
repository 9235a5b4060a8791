package org.netpreserve.sitemirror.path;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntraPageResolverTest {
    private static final String RAW = "29d979eeca9f4d41a9c5b1e1c1a4a6f0";
    private final TestPages pages = new TestPages();
    private final IntraPageResolver resolver = new IntraPageResolver();

    @Test
    public void testAnchorOnlyBlockLink() {
        var context = new PathContext(pages.lab1, null, "#" + RAW);
        assertTrue(resolver.supports(context));
        assertEquals("#29d979ee-ca9f-4d41-a9c5-b1e1c1a4a6f0", resolver.resolve(context));
    }

    @Test
    public void testAnchorOnlyPrefersRenderedId() {
        var context = new PathContext(pages.lab1, null, "#" + RAW, null,
                Map.of(pages.lab1.id(), Map.of(RAW, "29D979EE-CA9F-4D41-A9C5-B1E1C1A4A6F0")));
        assertEquals("#29D979EE-CA9F-4D41-A9C5-B1E1C1A4A6F0", resolver.resolve(context));
    }

    @Test
    public void testNamedAnchorIsKept() {
        assertEquals("#introduction", resolver.resolve(new PathContext(pages.lab1, null, "#introduction")));
    }

    @Test
    public void testSamePageLink() {
        var plain = new PathContext(pages.lab1, pages.lab1, pages.lab1.url().toString());
        assertTrue(resolver.supports(plain));
        assertEquals("", resolver.resolve(plain));

        var withBlock = new PathContext(pages.lab1, pages.lab1, pages.lab1.url().toString(), RAW, Map.of());
        assertEquals("#29d979ee-ca9f-4d41-a9c5-b1e1c1a4a6f0", resolver.resolve(withBlock));
    }

    @Test
    public void testOtherPagesAreNotSupported() {
        assertFalse(resolver.supports(new PathContext(pages.lab1, pages.lab2, "https://notes.test/x")));
        assertFalse(resolver.supports(new PathContext(pages.lab1, null, "https://elsewhere.test/")));
    }
}
