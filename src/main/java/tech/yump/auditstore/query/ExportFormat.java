package tech.yump.auditstore.query;

import java.util.Locale;

public enum ExportFormat {
    CSV("text/csv", "csv"),
    JSON("application/json", "json");

    private final String contentType;
    private final String extension;

    ExportFormat(String contentType, String extension) {
        this.contentType = contentType;
        this.extension = extension;
    }

    public String contentType() {
        return contentType;
    }

    public String extension() {
        return extension;
    }

    /**
     * @param value {@code "csv"} or {@code "json"}, in any case
     * @throws IllegalArgumentException for any other value
     */
    public static ExportFormat fromValue(String value) {
        if (value != null) {
            for (ExportFormat format : values()) {
                if (format.extension.equals(value.toLowerCase(Locale.ROOT))) {
                    return format;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported export format: " + value);
    }
}
