package com.orderschedule.simulation;

import java.time.LocalDate;

/**
 * Identifies a schedule event independently of its position in the list, so completion
 * flags can be carried over when a schedule is regenerated.
 */
public record EventKey(String sku, LocalDate arrivalDate, EventKind eventKind) {}
