package com.specsync.core.manifest;

import com.specsync.core.environment.Environment;
import com.specsync.core.layout.LayoutPatterns;
import com.specsync.core.model.Component;
import com.specsync.core.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Discovers components from specification and implementation files when no manifest exists.
 *
 * <p>A spec file's module name is its H1 title when that title is a module name, otherwise
 * it is derived from the path. Implementation files contribute the module they define, or
 * one derived from their path. Components found in both are merged; the spec file's intro
 * text becomes the description.
 */
public class ComponentDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ComponentDiscovery.class);

    private static final Pattern H1_MODULE = Pattern.compile("^# ([A-Z][a-zA-Z0-9_.]+)\\s*$", Pattern.MULTILINE);
    private static final Pattern DEFMODULE = Pattern.compile("defmodule\\s+([A-Z][a-zA-Z0-9_.]*)\\s+do", Pattern.MULTILINE);

    private final LayoutPatterns patterns;

    public ComponentDiscovery(LayoutPatterns patterns) {
        this.patterns = patterns;
    }

    /**
     * Scans the environment for components.
     *
     * @param environment project files
     * @return discovered architecture, without dependency edges
     * @throws IOException if the file listing fails
     */
    public Architecture discover(Environment environment) throws IOException {
        Map<String, Component> byModule = new LinkedHashMap<>();
        TemplateMatcher specs = new TemplateMatcher(patterns.spec());
        TemplateMatcher code = new TemplateMatcher(patterns.code());

        for (String file : environment.listFiles()) {
            Optional<String> specPath = specs.match(file);
            if (specPath.isPresent()) {
                discoverSpec(environment, file, specPath.get()).ifPresent(component -> merge(byModule, component));
                continue;
            }
            Optional<String> codePath = code.match(file);
            if (codePath.isPresent()) {
                discoverCode(environment, file, codePath.get()).ifPresent(component -> merge(byModule, component));
            }
        }

        log.info("Discovered {} components from project files", byModule.size());
        return new Architecture(null, NamespaceHierarchy.deriveParents(new ArrayList<>(byModule.values())), List.of());
    }

    private Optional<Component> discoverSpec(Environment environment, String file, String modulePath) {
        try {
            String content = environment.readFile(file);
            Matcher matcher = H1_MODULE.matcher(content);
            String moduleName = matcher.find() ? matcher.group(1) : pathToModule(modulePath);
            return Optional.of(component(moduleName, introText(content)));
        } catch (IOException e) {
            log.warn("Failed to read spec file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Component> discoverCode(Environment environment, String file, String modulePath) {
        try {
            Matcher matcher = DEFMODULE.matcher(environment.readFile(file));
            String moduleName = matcher.find() ? matcher.group(1) : pathToModule(modulePath);
            return Optional.of(component(moduleName, null));
        } catch (IOException e) {
            log.warn("Failed to read implementation file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private static void merge(Map<String, Component> byModule, Component found) {
        byModule.merge(found.moduleName(), found, (existing, incoming) ->
            existing.description() != null ? existing : incoming.description() != null ? incoming : existing);
    }

    private static Component component(String moduleName, String description) {
        return new Component(IdGenerator.generate(moduleName), null, moduleName,
            NamespaceHierarchy.typeFromNamespace(moduleName), null, description, null, List.of());
    }

    /**
     * Turns {@code my_app/accounts} into {@code MyApp.Accounts}.
     *
     * @param path underscored module path
     * @return module name
     */
    static String pathToModule(String path) {
        return Arrays.stream(path.split("/"))
            .map(segment -> Arrays.stream(segment.split("_"))
                .filter(part -> !part.isEmpty())
                .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1))
                .collect(Collectors.joining()))
            .collect(Collectors.joining("."));
    }

    static String introText(String content) {
        List<String> intro = new ArrayList<>();
        boolean inIntro = false;
        for (String line : content.split("\\R")) {
            if (!inIntro) {
                inIntro = line.startsWith("# ");
                continue;
            }
            if (line.startsWith("##")) {
                break;
            }
            intro.add(line);
        }
        String text = String.join("\n", intro).trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Matches file paths against a layout template and extracts the {@code {path}} part.
     */
    static final class TemplateMatcher {

        private final String prefix;
        private final String suffix;

        TemplateMatcher(String template) {
            int marker = template.indexOf("{path}");
            if (marker < 0) {
                throw new IllegalArgumentException("Layout template has no {path} placeholder: " + template);
            }
            this.prefix = template.substring(0, marker);
            this.suffix = template.substring(marker + "{path}".length());
        }

        Optional<String> match(String file) {
            if (file.length() <= prefix.length() + suffix.length()
                || !file.startsWith(prefix) || !file.endsWith(suffix)) {
                return Optional.empty();
            }
            return Optional.of(file.substring(prefix.length(), file.length() - suffix.length()));
        }
    }
}
