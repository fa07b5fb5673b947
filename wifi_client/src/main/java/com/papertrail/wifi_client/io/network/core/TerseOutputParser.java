package com.papertrail.wifi_client.io.network.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for the driver's terse ({@code -t}) output, where fields are
 * separated by ':' and a literal ':' inside a value is escaped as "\:".
 */
public final class TerseOutputParser {

    private TerseOutputParser() {
    }

    /**
     * Split a line on unescaped colons and unescape each field.
     */
    public static List<String> splitFields(String line) {
        List<String> fields = new ArrayList<>();
        if (line == null) {
            return fields;
        }
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\\' && i + 1 < line.length()) {
                current.append(line.charAt(++i));
            } else if (c == ':') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    /**
     * Split a {@code KEY:value} record on the first colon only.
     * @return a two element array, the value is empty when there is no colon
     */
    public static String[] splitFirst(String line) {
        int idx = line.indexOf(':');
        if (idx < 0) {
            return new String[]{line.trim(), ""};
        }
        return new String[]{line.substring(0, idx).trim(), unescape(line.substring(idx + 1).trim())};
    }

    /**
     * Remove the escaping backslashes from a single value.
     */
    public static String unescape(String value) {
        if (value == null || value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                sb.append(value.charAt(++i));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Escape a value the way the driver does in terse output.
     */
    public static String escape(String value) {
        return value.replace("\\", "\\\\").replace(":", "\\:");
    }

    /**
     * Lenient integer parse, unparsable input yields 0.
     */
    public static int parseIntOrZero(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
