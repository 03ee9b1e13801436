package com.orderschedule.repository;

import com.orderschedule.model.DemandItem;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Items from the most recently uploaded demand file, keyed by SKU. An upload replaces the
 * whole catalog atomically.
 */
@Repository
public class DemandCatalogRepository {

    private final AtomicReference<Map<String, DemandItem>> items = new AtomicReference<>(Map.of());

    public void replaceAll(List<DemandItem> uploaded) {
        Map<String, DemandItem> bySku = new LinkedHashMap<>();
        uploaded.forEach(item -> bySku.putIfAbsent(item.getSku(), item));
        items.set(Collections.unmodifiableMap(bySku));
    }

    public Optional<DemandItem> findBySku(String sku) {
        return Optional.ofNullable(items.get().get(sku));
    }

    public List<DemandItem> findAll() {
        return List.copyOf(items.get().values());
    }
}
