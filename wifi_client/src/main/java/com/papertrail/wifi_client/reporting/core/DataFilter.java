package com.papertrail.wifi_client.reporting.core;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Central filtering of sensitive values before reports leave the device.
 */
public class DataFilter {

    public static final String FILTERED = "[FILTERED]";

    private static final String[] SENSITIVE_KEYS = {
            "password", "psk", "passphrase", "token", "api_key", "dsn", "secret", "private_key"
    };

    // key=value or key: value pairs inside free text
    private static final Pattern SENSITIVE_ASSIGNMENT = Pattern.compile(
            "(?i)\\b(password|psk|passphrase|token|secret)(\\s*[=:]\\s*)(\"[^\"]*\"|\\S+)");

    private static final Pattern PSK_ARGUMENT = Pattern.compile("(?i)(wifi-sec\\.psk\\s+)(\"[^\"]*\"|\\S+)");

    /**
     * Filter sensitive data from a map
     *
     * @param data The original data map
     * @return A new map with sensitive values replaced
     */
    public static Map<String, Object> filterSensitiveData(Map<String, Object> data) {
        if (data == null) return null;

        Map<String, Object> filteredData = new HashMap<>();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (isSensitiveKey(entry.getKey())) {
                filteredData.put(entry.getKey(), FILTERED);
            } else if (entry.getValue() instanceof String) {
                filteredData.put(entry.getKey(), filterSensitiveText((String) entry.getValue()));
            } else {
                filteredData.put(entry.getKey(), entry.getValue());
            }
        }
        return filteredData;
    }

    /**
     * Mask secret values inside free text, keeping the surrounding message
     */
    public static String filterSensitiveText(String text) {
        if (text == null) return null;

        String filtered = SENSITIVE_ASSIGNMENT.matcher(text).replaceAll("$1$2" + FILTERED);
        return PSK_ARGUMENT.matcher(filtered).replaceAll("$1" + FILTERED);
    }

    public static boolean isSensitiveKey(String key) {
        if (key == null) return false;

        String lowerKey = key.toLowerCase();
        for (String sensitiveKey : SENSITIVE_KEYS) {
            if (lowerKey.contains(sensitiveKey)) {
                return true;
            }
        }
        return false;
    }

    public static ReportData filterReportData(ReportData reportData) {
        if (reportData == null) return null;

        return reportData.masked(
                filterSensitiveText(reportData.getMessage()),
                filterSensitiveData(reportData.getTags()),
                filterSensitiveData(reportData.getContext()));
    }
}
