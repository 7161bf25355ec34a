package com.phillippitts.freefleet.service.persistence;

import com.phillippitts.freefleet.config.properties.PersistenceProperties;
import com.phillippitts.freefleet.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JSON documents and JSON-lines files under the fleet cache directory.
 *
 * <p>Whole-document writes go to a sibling {@code .tmp} file that is then moved over the
 * target, so readers never observe a half-written document. A missing or corrupt document
 * reads as empty.
 */
@Component
public class JsonFileStore {

    private static final Logger LOG = LogManager.getLogger(JsonFileStore.class);

    private final Path root;

    @Autowired
    public JsonFileStore(PersistenceProperties properties) {
        this(properties.cacheDirectory());
    }

    public JsonFileStore(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public Path root() {
        return root;
    }

    public Path resolve(String fileName) {
        return root.resolve(fileName);
    }

    /**
     * Reads a JSON object document.
     *
     * @param fileName file name relative to the cache directory
     * @return the parsed object, or empty when the file is missing or not valid JSON
     */
    public Optional<JSONObject> readObject(String fileName) {
        Path file = resolve(fileName);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return Optional.of(new JSONObject(content));
        } catch (IOException | JSONException e) {
            LOG.warn("Failed to read or parse {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Replaces a JSON document atomically.
     *
     * @throws PersistenceException when the document cannot be written
     */
    public synchronized void writeObject(String fileName, JSONObject document) {
        Path file = resolve(fileName);
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(root);
            Files.writeString(temp, document.toString(2), StandardCharsets.UTF_8);
            moveIntoPlace(temp, file);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new PersistenceException(file, e);
        }
    }

    /**
     * Appends one line to a JSON-lines file, creating it when needed.
     *
     * @throws PersistenceException when the line cannot be written
     */
    public synchronized void appendLine(String fileName, String line) {
        Path file = resolve(fileName);
        try {
            Files.createDirectories(root);
            Files.writeString(file, line + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new PersistenceException(file, e);
        }
    }

    /**
     * Reads all non-blank lines of a file, oldest first. Missing or unreadable files read as empty.
     */
    public List<String> readLines(String fileName) {
        Path file = resolve(fileName);
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                    .filter(l -> !l.isBlank())
                    .toList();
        } catch (IOException e) {
            LOG.warn("Failed to read {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.debug("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
