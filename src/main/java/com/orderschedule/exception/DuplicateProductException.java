package com.orderschedule.exception;

public class DuplicateProductException extends OrderScheduleException {
    public DuplicateProductException(String sku) {
        super("DUPLICATE_PRODUCT", "Product with SKU '" + sku + "' is already added.");
    }
}
