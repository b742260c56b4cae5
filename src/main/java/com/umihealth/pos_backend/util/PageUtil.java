package com.umihealth.pos_backend.util;

public class PageUtil {

    private PageUtil() {
        // Utility class, no instantiation
    }

    /** Clamps a 1-based page number. */
    public static int normalizePage(int page) {
        return Math.max(page, 1);
    }

    public static int normalizeLimit(int limit) {
        if (limit < 1) {
            return Constants.DEFAULT_PAGE_SIZE;
        }
        return Math.min(limit, Constants.MAX_PAGE_SIZE);
    }
}
