package com.orderschedule.exception;

public class ProductNotFoundException extends OrderScheduleException {
    public ProductNotFoundException(String sku, String where) {
        super("PRODUCT_NOT_FOUND", "Product with SKU '" + sku + "' not found in " + where + ".");
    }
}
