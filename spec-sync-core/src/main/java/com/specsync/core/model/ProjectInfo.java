package com.specsync.core.model;

import java.util.Objects;

/**
 * Project identity used by file layout resolution.
 *
 * @param name human readable project name
 * @param moduleName root module namespace, for example {@code MyApp}
 */
public record ProjectInfo(String name, String moduleName) {

    public ProjectInfo {
        Objects.requireNonNull(name, "name must not be null");
        if (moduleName == null || moduleName.isBlank()) {
            moduleName = name;
        }
    }
}
