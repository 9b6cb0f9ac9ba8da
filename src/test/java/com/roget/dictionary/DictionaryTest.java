package com.roget.dictionary;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Dictionary.
 */
class DictionaryTest {

    private static Dictionary bundled;

    @BeforeAll
    static void loadDictionary() throws DictionaryException {
        bundled = Dictionary.load();
    }

    @Test
    void testLoadBundled() {
        assertTrue(bundled.size() > 0, "Should have loaded words");
        assertTrue(bundled.contains("about"));
        assertEquals(1226734006L, bundled.frequency("about"));
    }

    @Test
    void testBundledWordsAreFiveLetters() {
        for (String word : bundled.words()) {
            assertEquals(5, word.length(), word);
        }
    }

    @Test
    void testParseKeepsOrderAndCounts() throws DictionaryException {
        Dictionary dict = Dictionary.parse("right 10\n\nWRONG 5\r\nfight 0\n");
        assertEquals(List.of("right", "wrong", "fight"), dict.words());
        assertEquals(3, dict.size());
        assertEquals(5L, dict.frequency("wrong"));
        assertEquals(0L, dict.frequency("light"));
        assertTrue(dict.contains("fight"));
        assertFalse(dict.contains("light"));
        assertFalse(dict.contains(null));
    }

    @Test
    void testMissingSeparator() {
        DictionaryException e = assertThrows(DictionaryException.class,
                () -> Dictionary.parse("right 10\nwrong\n"));
        assertTrue(e.getMessage().contains("line 2"), e.getMessage());
    }

    @Test
    void testNonNumericCount() {
        DictionaryException e = assertThrows(DictionaryException.class,
                () -> Dictionary.parse("right ten\n"));
        assertTrue(e.getMessage().contains("line 1"), e.getMessage());
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    void testNegativeCount() {
        assertThrows(DictionaryException.class, () -> Dictionary.parse("right -3\n"));
    }

    @Test
    void testWrongWordLength() {
        assertThrows(DictionaryException.class, () -> Dictionary.parse("rights 3\n"));
    }

    @Test
    void testMissingResource() {
        assertThrows(DictionaryException.class, () -> Dictionary.fromResource("no-such-words.txt"));
    }

    @Test
    void testFromFile(@TempDir Path dir) throws IOException, DictionaryException {
        Path file = dir.resolve("words.txt");
        Files.writeString(file, "crane 7\nslate 3\n");
        Dictionary dict = Dictionary.fromFile(file.toString());
        assertEquals(2, dict.size());
        assertEquals(7L, dict.frequency("crane"));
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        assertThrows(DictionaryException.class,
                () -> Dictionary.fromFile(dir.resolve("missing.txt").toString()));
    }

    @Test
    void testViewsAreReadOnly() throws DictionaryException {
        Dictionary dict = Dictionary.parse("right 10\n");
        assertThrows(UnsupportedOperationException.class, () -> dict.words().add("wrong"));
        assertThrows(UnsupportedOperationException.class, () -> dict.frequencies().put("wrong", 1L));
    }
}
