package com.reminders.app;

import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

// Task lookup: recipe key -> display name and duration, read from a JSON object
public class RecipeBook {
    private static final Logger logger = Logger.getLogger(RecipeBook.class.getName());

    private final Map<String, Recipe> recipes;

    public RecipeBook(Map<String, Recipe> recipes) {
        this.recipes = Collections.unmodifiableMap(new LinkedHashMap<>(recipes));
    }

    // A named task with a fixed duration
    public static final class Recipe {
        private final String name;
        private final long durationSeconds;

        public Recipe(String name, long durationSeconds) {
            this.name = name;
            this.durationSeconds = durationSeconds;
        }

        public String getName() {
            return name;
        }

        public long getDurationSeconds() {
            return durationSeconds;
        }

        @Override
        public String toString() {
            return "Recipe{name='" + name + "', durationSeconds=" + durationSeconds + "}";
        }
    }

    /**
     * @param taskKey the recipe key
     * @return the recipe, or null if the key is unknown
     */
    public Recipe resolve(String taskKey) {
        return taskKey == null ? null : recipes.get(taskKey);
    }

    public Set<String> keys() {
        return recipes.keySet();
    }

    public int size() {
        return recipes.size();
    }

    /**
     * Read recipes from a file, falling back to a classpath resource of the same name.
     * A missing, empty or malformed source gives an empty book.
     */
    public static RecipeBook load(String path) {
        Path file = Path.of(path);
        if (Files.isRegularFile(file)) {
            try {
                return parse(Files.readString(file, StandardCharsets.UTF_8), path);
            } catch (IOException e) {
                logger.log(Level.WARNING, "Error reading recipes file " + path, e);
                return new RecipeBook(Collections.emptyMap());
            }
        }

        String resource = path.startsWith("/") ? path : "/" + path;
        try (InputStream in = RecipeBook.class.getResourceAsStream(resource)) {
            if (in == null) {
                logger.warning("Recipes " + path + " not found, no recipes available");
                return new RecipeBook(Collections.emptyMap());
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), resource);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Error reading recipes resource " + resource, e);
            return new RecipeBook(Collections.emptyMap());
        }
    }

    /**
     * Parse recipe JSON: an object keyed by recipe key, each value holding
     * {@code name} and {@code durationSeconds}. Entries missing either field are skipped.
     */
    static RecipeBook parse(String json, String source) {
        if (json == null || json.isBlank()) {
            logger.info("Read empty recipes from " + source);
            return new RecipeBook(Collections.emptyMap());
        }

        JSONObject root;
        try {
            root = new JSONObject(json);
        } catch (JSONException e) {
            logger.log(Level.WARNING, "Error parsing recipes from " + source, e);
            return new RecipeBook(Collections.emptyMap());
        }

        Map<String, Recipe> recipes = new LinkedHashMap<>();
        for (String key : root.keySet()) {
            JSONObject entry = root.optJSONObject(key);
            if (entry == null || !entry.has("name") || !entry.has("durationSeconds")) {
                logger.warning("Skipping recipe '" + key + "': name and durationSeconds are required");
                continue;
            }
            try {
                recipes.put(key, new Recipe(entry.getString("name"), entry.getLong("durationSeconds")));
            } catch (JSONException e) {
                logger.warning("Skipping recipe '" + key + "': " + e.getMessage());
            }
        }

        logger.info("Read " + recipes.size() + " recipes from " + source);
        return new RecipeBook(recipes);
    }
}
