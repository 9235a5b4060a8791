package org.netpreserve.sitemirror.path;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InterPageResolverTest {
    private final TestPages pages = new TestPages();
    private final InterPageResolver resolver = new InterPageResolver();

    private String resolve(PathContext context) {
        assertTrue(resolver.supports(context));
        return resolver.resolve(context);
    }

    @Test
    public void testChildToRoot() {
        assertEquals("../index.html", resolve(new PathContext(pages.week1, pages.course, "x")));
    }

    @Test
    public void testRootToChild() {
        assertEquals("Week_1/Lab_1/index.html", resolve(new PathContext(pages.course, pages.lab1, "x")));
    }

    @Test
    public void testSiblings() {
        assertEquals("../Lecture_Notes/index.html", resolve(new PathContext(pages.lab1, pages.notes, "x")));
    }

    @Test
    public void testDivergentBranches() {
        assertEquals("../../Week_2/Lab_2/index.html", resolve(new PathContext(pages.lab1, pages.lab2, "x")));
        assertEquals("../index.html", resolve(new PathContext(pages.lab2, pages.week2, "x")));
    }

    @Test
    public void testBlockAnchorUsesTargetsRenderedId() {
        String raw = "0123456789abcdef0123456789abcdef";
        var cached = new PathContext(pages.lab1, pages.lab2, "x", raw,
                Map.of(pages.lab2.id(), Map.of(raw, "0123456789ABCDEF0123456789ABCDEF")));
        assertEquals("../../Week_2/Lab_2/index.html#0123456789ABCDEF0123456789ABCDEF", resolve(cached));

        var uncached = new PathContext(pages.lab1, pages.lab2, "x", raw, Map.of());
        assertEquals("../../Week_2/Lab_2/index.html#01234567-89ab-cdef-0123-456789abcdef", resolve(uncached));
    }

    @Test
    public void testUpTokensMatchSourceDepthBeyondCommonPrefix() {
        var all = List.of(pages.course, pages.week1, pages.lab1, pages.notes, pages.week2, pages.lab2);
        for (var source : all) {
            for (var target : all) {
                if (source == target) continue;
                String path = resolve(new PathContext(source, target, "x"));
                int common = InterPageResolver.commonPrefixLength(source.pathSegments(), target.pathSegments());
                int ups = (path.length() - path.replace("../", "").length()) / 3;
                assertEquals(source.pathSegments().size() - common, ups, source + " -> " + target);
                assertTrue(path.endsWith("index.html"));
            }
        }
    }

    @Test
    public void testDoesNotSupportSamePageOrMissingTarget() {
        assertFalse(resolver.supports(new PathContext(pages.lab1, pages.lab1, "x")));
        assertFalse(resolver.supports(new PathContext(pages.lab1, null, "https://elsewhere.test/")));
    }

    @Test
    public void testCommonPrefixLength() {
        assertEquals(0, InterPageResolver.commonPrefixLength(List.of(), List.of("a")));
        assertEquals(1, InterPageResolver.commonPrefixLength(List.of("a", "b"), List.of("a", "c")));
        assertEquals(2, InterPageResolver.commonPrefixLength(List.of("a", "b"), List.of("a", "b", "c")));
    }
}
