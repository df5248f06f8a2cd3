package com.reminders.app;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class RecipeBookTest {

    @Test
    public void testLoadFromClasspath() {
        RecipeBook book = RecipeBook.load("recipes-test.json");

        assertEquals(2, book.size());
        RecipeBook.Recipe smelter = book.resolve("smelter_iron");
        assertNotNull(smelter);
        assertEquals("Smelter", smelter.getName());
        assertEquals(10, smelter.getDurationSeconds());
        assertEquals(1, book.resolve("quick_test").getDurationSeconds());
    }

    @Test
    public void testBundledRecipes() {
        RecipeBook book = RecipeBook.load("recipes.json");

        assertTrue(book.size() > 0);
        assertEquals("Smelter", book.resolve("smelter_iron").getName());
    }

    @Test
    public void testLoadFromFileWinsOverClasspath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("recipes.json");
        Files.writeString(file, "{\"kiln\": {\"name\": \"Kiln\", \"durationSeconds\": 45}}", StandardCharsets.UTF_8);

        RecipeBook book = RecipeBook.load(file.toString());

        assertEquals(1, book.size());
        assertEquals("Kiln", book.resolve("kiln").getName());
        assertNull(book.resolve("smelter_iron"));
    }

    @Test
    public void testMissingSourceGivesEmptyBook() {
        RecipeBook book = RecipeBook.load("no-such-recipes.json");

        assertEquals(0, book.size());
        assertNull(book.resolve("smelter_iron"));
    }

    @Test
    public void testMalformedSourceGivesEmptyBook() {
        assertEquals(0, RecipeBook.load("recipes-malformed.json").size());
        assertEquals(0, RecipeBook.parse("   ", "blank").size());
        assertEquals(0, RecipeBook.parse(null, "null").size());
    }

    @Test
    public void testIncompleteEntriesSkipped() {
        String json = "{"
                + "\"good\": {\"name\": \"Good\", \"durationSeconds\": 5},"
                + "\"no_name\": {\"durationSeconds\": 5},"
                + "\"no_duration\": {\"name\": \"Nope\"},"
                + "\"bad_duration\": {\"name\": \"Bad\", \"durationSeconds\": \"soon\"},"
                + "\"not_an_object\": 12"
                + "}";

        RecipeBook book = RecipeBook.parse(json, "inline");

        assertEquals(1, book.size());
        assertTrue(book.keys().contains("good"));
    }

    @Test
    public void testResolveNullKey() {
        assertNull(RecipeBook.load("recipes-test.json").resolve(null));
    }
}
