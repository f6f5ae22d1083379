package com.ioms.inventoryservice.query.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalises names coming from query parameters. Paths may be written with
 * {@code .} or {@code __} separators and tokens in snake_case or camelCase.
 */
public final class SchemaNames {

    private static final Pattern PATH_SEPARATOR = Pattern.compile("\\.|__");

    private SchemaNames() {
    }

    public static List<String> splitPath(String path) {
        List<String> tokens = new ArrayList<>();
        if (path == null || path.isBlank()) {
            return tokens;
        }
        for (String token : PATH_SEPARATOR.split(path.trim(), -1)) {
            tokens.add(token.trim());
        }
        return tokens;
    }

    /**
     * {@code created_at} becomes {@code createdAt}; names already in camelCase are returned unchanged.
     */
    public static String toCamelCase(String token) {
        if (token.indexOf('_') < 0) {
            return token;
        }
        StringBuilder result = new StringBuilder(token.length());
        boolean upperNext = false;
        for (char c : token.toCharArray()) {
            if (c == '_') {
                upperNext = result.length() > 0;
                continue;
            }
            result.append(upperNext ? Character.toUpperCase(c) : c);
            upperNext = false;
        }
        return result.toString();
    }

    static String key(String token) {
        return toCamelCase(token).toLowerCase(Locale.ROOT);
    }
}
