package com.roget;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private static int execute(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    @Test
    void testScore() {
        assertEquals(0, execute("score", "right", "wrong"));
        assertEquals(1, execute("score", "right", "wrongs"));
    }

    @Test
    void testPlayBundled() {
        assertEquals(0, execute("play", "-n", "3"));
        assertEquals(0, execute("play", "-n", "3", "--json"));
    }

    @Test
    void testPlayWithFiles(@TempDir Path dir) throws IOException {
        Path words = dir.resolve("words.txt");
        Path answers = dir.resolve("answers.txt");
        Files.writeString(words, "right 10\nwrong 20\nfight 5\n");
        Files.writeString(answers, "right fight\n");
        assertEquals(0, execute("play", "-d", words.toString(), "-a", answers.toString(), "-p"));
    }

    @Test
    void testMalformedDictionaryFails(@TempDir Path dir) throws IOException {
        Path words = dir.resolve("words.txt");
        Files.writeString(words, "right\n");
        assertEquals(1, execute("play", "-d", words.toString()));
    }

    @Test
    void testAnswerOutsideDictionaryFails(@TempDir Path dir) throws IOException {
        Path words = dir.resolve("words.txt");
        Path answers = dir.resolve("answers.txt");
        Files.writeString(words, "right 10\n");
        Files.writeString(answers, "light\n");
        assertEquals(1, execute("play", "-d", words.toString(), "-a", answers.toString()));
    }

    @Test
    void testBadTurnLimitFails() {
        assertEquals(1, execute("play", "-m", "0"));
    }
}
