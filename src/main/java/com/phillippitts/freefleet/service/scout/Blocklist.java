package com.phillippitts.freefleet.service.scout;

import com.phillippitts.freefleet.domain.FreeModel;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Provider tokens that must never be routed through the free pathway.
 *
 * <p>A model is blocked when its provider equals a token or its id contains one,
 * case-insensitively.
 */
public final class Blocklist {

    public static final Blocklist EMPTY = new Blocklist(Set.of());

    private final Set<String> tokens;

    public Blocklist(Collection<String> tokens) {
        Set<String> normalized = new TreeSet<>();
        for (String t : tokens) {
            if (t != null && !t.isBlank()) {
                normalized.add(t.toLowerCase(Locale.ROOT));
            }
        }
        this.tokens = Set.copyOf(normalized);
    }

    public boolean blocks(FreeModel model) {
        String provider = model.provider().toLowerCase(Locale.ROOT);
        String id = model.id().toLowerCase(Locale.ROOT);
        return tokens.stream().anyMatch(t -> provider.equals(t) || id.contains(t));
    }

    public boolean blocksProvider(String providerId) {
        return tokens.contains(providerId.toLowerCase(Locale.ROOT));
    }

    public Set<String> tokens() {
        return new TreeSet<>(tokens);
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    @Override
    public String toString() {
        return "Blocklist" + tokens();
    }
}
