package ebulter.hanabi.store.persistence;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import ebulter.hanabi.store.model.Artwork;
import ebulter.hanabi.store.model.ArtworkListData;
import ebulter.hanabi.store.model.ChallengeRequest;
import ebulter.hanabi.store.model.RequestListData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON export/import of the record collections and the file I/O around it.
 * <p>
 * Every collection is written wrapped in a single-field object
 * ({@code {"artworks": [...]}} / {@code {"requests": [...]}}), never as a bare array.
 * Imports never throw: missing, blank or malformed input yields an empty list.
 */
public final class JsonPersistence {
    private static final Logger logger = LoggerFactory.getLogger(JsonPersistence.class);
    private static final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeSpecialFloatingPointValues()
            .create();

    private JsonPersistence() {
    }

    // Artworks

    public static String exportAllArtworks(List<Artwork> artworks) {
        List<Artwork> copy = artworks == null ? new ArrayList<>() : new ArrayList<>(artworks);
        return gson.toJson(new ArtworkListData(copy));
    }

    public static List<Artwork> importArtworks(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }

        try {
            ArtworkListData data = gson.fromJson(json, ArtworkListData.class);
            return data == null ? new ArrayList<>() : withoutNulls(data.getArtworks());
        } catch (JsonParseException e) {
            logger.warn("Failed to import artworks: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    // Requests

    public static String exportAllRequests(List<ChallengeRequest> requests) {
        List<ChallengeRequest> copy = requests == null ? new ArrayList<>() : new ArrayList<>(requests);
        return gson.toJson(new RequestListData(copy));
    }

    public static List<ChallengeRequest> importRequests(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }

        try {
            RequestListData data = gson.fromJson(json, RequestListData.class);
            return data == null ? new ArrayList<>() : withoutNulls(data.getRequests());
        } catch (JsonParseException e) {
            logger.warn("Failed to import requests: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    // File I/O

    /**
     * Writes the JSON as UTF-8, creating missing parent directories.
     * Returns false if the write failed; the failure is logged, not thrown.
     */
    public static boolean saveToFile(String json, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, json == null ? "" : json, StandardCharsets.UTF_8);
            logger.debug("Saved {} characters to {}", json == null ? 0 : json.length(), path);
            return true;
        } catch (IOException e) {
            logger.warn("Failed to save file {}: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * Reads a UTF-8 file. Returns null if the file does not exist or cannot be read.
     */
    public static String loadFromFile(Path path) {
        if (!Files.isRegularFile(path)) {
            return null;
        }

        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("Failed to load file {}: {}", path, e.getMessage());
            return null;
        }
    }

    private static <T> List<T> withoutNulls(List<T> items) {
        List<T> result = new ArrayList<>();
        if (items != null) {
            items.stream().filter(Objects::nonNull).forEach(result::add);
        }
        return result;
    }
}
