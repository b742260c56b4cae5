package com.umihealth.pos_backend.util;

public class Constants {

    private Constants() {
        // Utility class, no instantiation
    }

    public static final String API_BASE_PATH = "/api/v1";

    // Pagination Constants
    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 100;

    // Success Messages
    public static final String SUCCESS_SALE_CREATED = "Sale created successfully";
    public static final String SUCCESS_SALE_UPDATED = "Sale updated successfully";
    public static final String SUCCESS_SALE_DELETED = "Sale deleted successfully";
    public static final String SUCCESS_RESTOCKED = "Inventory restocked successfully";
}
