package com.phillippitts.freefleet.service.oracle;

import com.phillippitts.freefleet.domain.ModelMetadata;
import com.phillippitts.freefleet.exception.PersistenceException;
import com.phillippitts.freefleet.service.persistence.JsonFileStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Durable oracle verdicts keyed by bare model id, stored in {@code metadata.json}.
 *
 * <p>Entries never expire on their own; use {@link #forget(String)} or {@link #clear()}.
 */
@Component
public class MetadataCache {

    private static final Logger LOG = LogManager.getLogger(MetadataCache.class);

    static final String FILE_NAME = "metadata.json";

    private final JsonFileStore store;
    private final ConcurrentMap<String, ModelMetadata> entries = new ConcurrentHashMap<>();

    public MetadataCache(JsonFileStore store) {
        this.store = store;
        load();
    }

    public Optional<ModelMetadata> get(String modelId) {
        return Optional.ofNullable(entries.get(modelId));
    }

    public void put(String modelId, ModelMetadata metadata) {
        entries.put(modelId, metadata);
        save();
    }

    public boolean forget(String modelId) {
        boolean removed = entries.remove(modelId) != null;
        if (removed) {
            save();
        }
        return removed;
    }

    public void clear() {
        entries.clear();
        save();
    }

    public int size() {
        return entries.size();
    }

    private void load() {
        store.readObject(FILE_NAME).ifPresent(root -> {
            for (String id : root.keySet()) {
                try {
                    entries.put(id, ModelMetadata.fromJson(root.getJSONObject(id)));
                } catch (JSONException | IllegalArgumentException | DateTimeParseException e) {
                    LOG.warn("Dropping unreadable cached verdict for {}: {}", id, e.getMessage());
                }
            }
            LOG.info("Loaded {} cached model verdicts", entries.size());
        });
    }

    private synchronized void save() {
        JSONObject root = new JSONObject();
        entries.forEach((id, m) -> root.put(id, m.toJson()));
        try {
            store.writeObject(FILE_NAME, root);
        } catch (PersistenceException e) {
            LOG.warn("Failed to persist metadata cache: {}", e.getMessage());
        }
    }
}
