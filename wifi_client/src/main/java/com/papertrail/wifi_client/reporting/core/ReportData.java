package com.papertrail.wifi_client.reporting.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One report as handed to the providers. Immutable, built through {@link Builder}.
 */
public class ReportData {
    private final String message;
    private final ReportLevel level;
    private final String category;
    private final String operation;
    private final Map<String, Object> tags;
    private final Map<String, Object> context;
    private final Throwable exception;
    private final long timestamp;

    private ReportData(String message, ReportLevel level, String category, String operation,
                       Map<String, Object> tags, Map<String, Object> context,
                       Throwable exception, long timestamp) {
        this.message = message;
        this.level = level;
        this.category = category;
        this.operation = operation;
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.exception = exception;
        this.timestamp = timestamp;
    }

    public String getMessage() {
        return message;
    }

    public ReportLevel getLevel() {
        return level;
    }

    public String getCategory() {
        return category;
    }

    /** Empty when the report is not tied to one operation. */
    public String getOperation() {
        return operation;
    }

    public Map<String, Object> getTags() {
        return tags;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public Throwable getException() {
        return exception;
    }

    public long getTimestamp() {
        return timestamp;
    }

    /**
     * Copy with replaced text and maps, keeping level, category, operation, exception and time.
     */
    ReportData masked(String maskedMessage, Map<String, Object> maskedTags, Map<String, Object> maskedContext) {
        return new ReportData(maskedMessage, level, category, operation,
                maskedTags, maskedContext, exception, timestamp);
    }

    public static class Builder {
        private String message;
        private ReportLevel level = ReportLevel.INFO;
        private String category = "wifi";
        private String operation = "";
        private final Map<String, Object> tags = new LinkedHashMap<>();
        private final Map<String, Object> context = new LinkedHashMap<>();
        private Throwable exception;

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder level(ReportLevel level) {
            this.level = level;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public Builder tag(String key, Object value) {
            tags.put(key, value);
            return this;
        }

        public Builder context(String key, Object value) {
            context.put(key, value);
            return this;
        }

        public Builder exception(Throwable exception) {
            this.exception = exception;
            return this;
        }

        /**
         * @throws IllegalArgumentException without a message
         */
        public ReportData build() {
            if (message == null || message.isEmpty()) {
                throw new IllegalArgumentException("Report message is required");
            }
            return new ReportData(message, level, category, operation, tags, context,
                    exception, System.currentTimeMillis());
        }
    }
}
