package com.roget.dictionary;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable set of allowed guesses, each with an occurrence count.
 * Loaded from lines of the form "word count".
 */
public final class Dictionary {
    public static final String DEFAULT_RESOURCE = "dictionary.txt";
    public static final int WORD_LENGTH = 5;

    private final Map<String, Long> frequencies;
    private final List<String> words;

    private Dictionary(Map<String, Long> frequencies) {
        this.frequencies = Collections.unmodifiableMap(frequencies);
        this.words = List.copyOf(frequencies.keySet());
    }

    /**
     * Load the word list bundled with the application.
     */
    public static Dictionary load() throws DictionaryException {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Load a word list from a file.
     */
    public static Dictionary fromFile(String path) throws DictionaryException {
        try {
            String content = Files.readString(Path.of(path));
            return parse(content);
        } catch (IOException e) {
            throw new DictionaryException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load a word list from a classpath resource.
     */
    public static Dictionary fromResource(String resourcePath) throws DictionaryException {
        try (InputStream is = Dictionary.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new DictionaryException("Resource not found: " + resourcePath);
            }
            return parse(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DictionaryException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Parse a word list. Blank lines are skipped; any other malformed line fails the load.
     */
    public static Dictionary parse(String content) throws DictionaryException {
        Map<String, Long> frequencies = new LinkedHashMap<>();
        String[] lines = content.split("\\R");

        for (int lineNum = 0; lineNum < lines.length; lineNum++) {
            String line = lines[lineNum].trim();
            if (line.isEmpty()) {
                continue;
            }

            int spaceIdx = line.indexOf(' ');
            if (spaceIdx == -1) {
                throw new DictionaryException("Invalid dictionary format at line " + (lineNum + 1)
                        + ": Expected format 'WORD COUNT'");
            }

            String word = line.substring(0, spaceIdx).toLowerCase(Locale.ROOT);
            String countStr = line.substring(spaceIdx + 1).trim();

            if (word.length() != WORD_LENGTH) {
                throw new DictionaryException("Invalid dictionary format at line " + (lineNum + 1)
                        + ": '" + word + "' is not a " + WORD_LENGTH + "-letter word");
            }

            long count;
            try {
                count = Long.parseLong(countStr);
            } catch (NumberFormatException e) {
                throw new DictionaryException("Invalid dictionary format at line " + (lineNum + 1)
                        + ": '" + countStr + "' is not a valid number", e);
            }
            if (count < 0) {
                throw new DictionaryException("Invalid dictionary format at line " + (lineNum + 1)
                        + ": count must not be negative");
            }

            frequencies.put(word, count);
        }

        return new Dictionary(frequencies);
    }

    public boolean contains(String word) {
        return word != null && frequencies.containsKey(word);
    }

    public int size() {
        return frequencies.size();
    }

    /**
     * All words, in the order they were loaded.
     */
    public List<String> words() {
        return words;
    }

    /**
     * Occurrence count of a word, 0 if it is not in the dictionary.
     */
    public long frequency(String word) {
        return frequencies.getOrDefault(word, 0L);
    }

    /**
     * Word to count, in load order. Not interpreted by the game itself.
     */
    public Map<String, Long> frequencies() {
        return frequencies;
    }
}
