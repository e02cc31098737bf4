package com.specsync.core.document;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Section structure a Markdown document of a given type must follow.
 *
 * <p>Each entry of {@code requiredSections} is a group of alternatives: the document must
 * contain at least one H2 section from every group.
 *
 * @param name document type name
 * @param requiredSections required section groups, lowercase
 * @param optionalSections sections that may appear, lowercase
 * @param allowAdditionalSections whether sections outside both lists are accepted
 */
public record DocumentType(
    String name,
    List<List<String>> requiredSections,
    List<String> optionalSections,
    boolean allowAdditionalSections
) {

    public DocumentType {
        Objects.requireNonNull(name, "name must not be null");
        requiredSections = requiredSections == null ? List.of() : requiredSections.stream()
            .map(group -> group.stream().map(DocumentType::normalize).toList())
            .toList();
        optionalSections = optionalSections == null ? List.of() : optionalSections.stream()
            .map(DocumentType::normalize)
            .toList();
    }

    /**
     * Returns whether a section name appears in the required groups or the optional list.
     *
     * @param section normalized section name
     * @return true if the section is known to this type
     */
    public boolean isKnownSection(String section) {
        return optionalSections.contains(section)
            || requiredSections.stream().anyMatch(group -> group.contains(section));
    }

    static String normalize(String section) {
        return section.trim().toLowerCase(Locale.ROOT);
    }
}
