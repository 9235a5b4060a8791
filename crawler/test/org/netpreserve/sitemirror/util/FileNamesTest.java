package org.netpreserve.sitemirror.util;

import org.junit.jupiter.api.Test;
import org.netpreserve.sitemirror.Mirror;
import org.netpreserve.sitemirror.blockid.BlockIdMapper;
import org.netpreserve.sitemirror.path.FilesystemResolver;

import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

class FileNamesTest {
    @Test
    public void testSanitize() {
        assertEquals("Lab_1_Sockets", FileNames.sanitize("Lab 1: Sockets"));
        assertEquals("a_b", FileNames.sanitize("  a \t b  "));
        assertEquals("What_is_this", FileNames.sanitize("What is <this>?"));
        assertEquals("hidden", FileNames.sanitize("..hidden.."));
        assertEquals("Untitled", FileNames.sanitize("???"));
        assertEquals("Untitled", FileNames.sanitize(""));
        assertEquals("CON_", FileNames.sanitize("con".toUpperCase()));
        assertEquals("nul_", FileNames.sanitize("nul"));
        assertEquals("Résumé_📄", FileNames.sanitize("Résumé 📄"));
    }

    @Test
    public void testLongNamesAreBoundedWithHash() {
        String first = FileNames.sanitize("x".repeat(300) + "A");
        String second = FileNames.sanitize("x".repeat(300) + "B");
        assertEquals(FileNames.MAX_LENGTH, first.length());
        assertTrue(first.matches("x{141}_[0-9a-f]{8}"), first);
        assertNotEquals(first, second);
    }

    @Test
    public void testUnique() {
        var taken = new HashSet<String>();
        assertEquals("Notes", FileNames.unique("Notes", taken));
        assertEquals("Notes_2", FileNames.unique("Notes", taken));
        assertEquals("NOTES_3", FileNames.unique("NOTES", taken));
        assertEquals("Other", FileNames.unique("Other", taken));
        assertTrue(taken.contains("notes_2"));
    }

    @Test
    public void testOutputFilesCoverEverythingTheMirrorWrites() {
        assertTrue(FileNames.OUTPUT_FILES.contains(FilesystemResolver.INDEX_FILE));
        assertTrue(FileNames.OUTPUT_FILES.contains(BlockIdMapper.SIDECAR));
        assertTrue(FileNames.OUTPUT_FILES.contains(Mirror.GRAPH_FILE));
    }
}
