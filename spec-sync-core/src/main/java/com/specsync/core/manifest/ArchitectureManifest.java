package com.specsync.core.manifest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * YAML form of a project's components and their dependencies.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: Shop
 *   moduleName: Shop
 *
 * components:
 *   - moduleName: Shop.Accounts
 *     type: context
 *   - moduleName: Shop.Accounts.User
 *     type: schema
 *   - moduleName: Shop.Orders
 *     type: context
 *     dependsOn: [Shop.Accounts]
 * }</pre>
 *
 * @param project project identity, optional
 * @param components component entries
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArchitectureManifest(
    @JsonProperty("project") ProjectEntry project,
    @JsonProperty("components") List<ComponentEntry> components
) {

    public ArchitectureManifest {
        components = components == null ? List.of() : components;
    }

    /**
     * @param name project name
     * @param moduleName root module namespace
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectEntry(
        @JsonProperty("name") String name,
        @JsonProperty("moduleName") String moduleName
    ) {}

    /**
     * @param id explicit id, derived from the module name when absent
     * @param moduleName fully qualified module name
     * @param name display name
     * @param type type tag, derived from namespace depth when absent
     * @param parent parent module name, derived from the nearest namespace ancestor when absent
     * @param description description
     * @param dependsOn module names this component depends on
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ComponentEntry(
        @JsonProperty("id") String id,
        @JsonProperty("moduleName") String moduleName,
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("parent") String parent,
        @JsonProperty("description") String description,
        @JsonProperty("dependsOn") List<String> dependsOn
    ) {
        public ComponentEntry {
            dependsOn = dependsOn == null ? List.of() : dependsOn;
        }
    }
}
