package com.orderschedule.repository;

import com.orderschedule.model.BoardEntry;
import com.orderschedule.simulation.EventKey;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Products added to the board and their completion overlays, held for the lifetime of the
 * process. Completion flags are keyed by {@link EventKey} rather than by list position so a
 * regenerated schedule picks up the flags of events that still exist.
 */
@Repository
public class ProductBoardRepository {

    private final ConcurrentHashMap<String, BoardEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Map<EventKey, Boolean>> completions = new ConcurrentHashMap<>();

    /** @return false if an entry with the same SKU already exists */
    public boolean addIfAbsent(BoardEntry entry) {
        return entries.putIfAbsent(entry.getSku(), entry) == null;
    }

    public BoardEntry replace(BoardEntry entry) {
        entries.put(entry.getSku(), entry);
        return entry;
    }

    public Optional<BoardEntry> findBySku(String sku) {
        return Optional.ofNullable(entries.get(sku));
    }

    public boolean existsBySku(String sku) {
        return entries.containsKey(sku);
    }

    public List<BoardEntry> findAll() {
        return entries.values().stream()
            .sorted(Comparator.comparing(BoardEntry::getAddedAt).thenComparing(BoardEntry::getSku))
            .toList();
    }

    public void setCompleted(EventKey key, boolean completed) {
        completions.computeIfAbsent(key.sku(), sku -> new ConcurrentHashMap<>()).put(key, completed);
    }

    public boolean isCompleted(EventKey key) {
        Map<EventKey, Boolean> overlay = completions.get(key.sku());
        return overlay != null && overlay.getOrDefault(key, false);
    }
}
