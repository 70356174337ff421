package com.williamcallahan.book_import_engine.controller.support;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Consistent error payloads for the import API.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
    }

    /**
     * Body of the form {@code {"error": code, "message": detail}}; the message is omitted when blank.
     */
    public static Map<String, String> errorBody(String code, String detail) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", code);
        if (detail != null && !detail.isBlank()) {
            body.put("message", detail);
        }
        return body;
    }
}
