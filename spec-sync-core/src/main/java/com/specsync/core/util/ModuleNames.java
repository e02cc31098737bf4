package com.specsync.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Helpers for dotted module names such as {@code MyApp.Accounts.UserRepository}.
 */
public final class ModuleNames {

    private ModuleNames() {
        // Utility class
    }

    /**
     * Converts a module name into a relative path.
     *
     * <p>{@code MyApp.Accounts.HTTPClient} becomes {@code my_app/accounts/http_client}.
     *
     * @param moduleName dotted module name
     * @return slash separated, underscored path
     */
    public static String toPath(String moduleName) {
        if (moduleName == null || moduleName.isBlank()) {
            throw new IllegalArgumentException("Module name must not be null or blank");
        }
        List<String> parts = new ArrayList<>();
        for (String segment : segments(moduleName)) {
            parts.add(underscore(segment));
        }
        return String.join("/", parts);
    }

    /**
     * Converts a single CamelCase segment to snake_case.
     *
     * @param segment module name segment
     * @return underscored segment
     */
    public static String underscore(String segment) {
        StringBuilder out = new StringBuilder(segment.length() + 4);
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (Character.isUpperCase(c) && i > 0) {
                char prev = segment.charAt(i - 1);
                boolean nextIsLower = i + 1 < segment.length() && Character.isLowerCase(segment.charAt(i + 1));
                if (Character.isLowerCase(prev) || Character.isDigit(prev)
                    || (Character.isUpperCase(prev) && nextIsLower)) {
                    out.append('_');
                }
            }
            out.append(Character.toLowerCase(c));
        }
        return out.toString().toLowerCase(Locale.ROOT);
    }

    public static List<String> segments(String moduleName) {
        return List.of(moduleName.trim().split("\\."));
    }

    /**
     * Returns the enclosing namespace of a module name.
     *
     * @param moduleName dotted module name
     * @return the name without its last segment, or empty for a single segment name
     */
    public static Optional<String> parentNamespace(String moduleName) {
        int lastDot = moduleName.lastIndexOf('.');
        return lastDot > 0 ? Optional.of(moduleName.substring(0, lastDot)) : Optional.empty();
    }

    public static int depth(String moduleName) {
        return segments(moduleName).size();
    }
}
