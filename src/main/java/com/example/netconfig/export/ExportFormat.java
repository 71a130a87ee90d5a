package com.example.netconfig.export;

import org.springframework.http.MediaType;

import java.util.Locale;

/**
 * Encodings selectable through the {@code format} query parameter.
 */
public enum ExportFormat {
    JSON(MediaType.APPLICATION_JSON),
    CSV(new MediaType("text", "csv")),
    TSV(new MediaType("text", "tab-separated-values")),
    SIMPLE(MediaType.TEXT_PLAIN);

    private final MediaType mediaType;

    ExportFormat(MediaType mediaType) {
        this.mediaType = mediaType;
    }

    public MediaType mediaType() {
        return mediaType;
    }

    /**
     * Case-insensitive lookup. Blank or unrecognised values select {@link #JSON}.
     */
    public static ExportFormat fromParam(String param) {
        if (param == null) {
            return JSON;
        }
        String p = param.trim().toUpperCase(Locale.ROOT);
        for (ExportFormat f : values()) {
            if (f.name().equals(p)) {
                return f;
            }
        }
        return JSON;
    }
}
