package com.specsync.core.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link DocumentValidator} that checks the H2 section structure of a Markdown document.
 *
 * <p>The H1 heading is the document title and is not treated as a section. Headings
 * inside fenced code blocks are ignored.
 */
public class MarkdownSectionValidator implements DocumentValidator {

    private static final Logger log = LoggerFactory.getLogger(MarkdownSectionValidator.class);

    private static final Pattern H2_PATTERN = Pattern.compile("^##\\s+(.+?)\\s*#*\\s*$");
    private static final String FENCE = "```";

    private final Function<String, Optional<DocumentType>> documentTypes;

    public MarkdownSectionValidator() {
        this(DocumentTypes::find);
    }

    public MarkdownSectionValidator(Function<String, Optional<DocumentType>> documentTypes) {
        this.documentTypes = documentTypes;
    }

    @Override
    public ValidationOutcome validate(String content, String documentTypeName) {
        Optional<DocumentType> documentType = documentTypes.apply(documentTypeName);
        if (documentType.isEmpty()) {
            return ValidationOutcome.invalid(List.of("Unknown document type: " + documentTypeName));
        }
        if (content == null || content.isBlank()) {
            return ValidationOutcome.invalid(List.of("Document is empty"));
        }

        Set<String> sections = extractSections(content);
        log.debug("Found sections {} for document type {}", sections, documentTypeName);

        DocumentType type = documentType.get();
        List<String> errors = new ArrayList<>();
        for (List<String> group : type.requiredSections()) {
            if (group.stream().noneMatch(sections::contains)) {
                errors.add(group.size() == 1
                    ? "Missing required section: " + group.get(0)
                    : "Missing one of required sections: " + String.join(", ", group));
            }
        }
        if (!type.allowAdditionalSections()) {
            List<String> unexpected = sections.stream()
                .filter(section -> !type.isKnownSection(section))
                .toList();
            if (!unexpected.isEmpty()) {
                errors.add("Unexpected sections: " + String.join(", ", unexpected));
            }
        }
        return errors.isEmpty() ? ValidationOutcome.ok() : ValidationOutcome.invalid(errors);
    }

    /**
     * Extracts normalized H2 section names in document order.
     *
     * @param content Markdown text
     * @return lowercase section names
     */
    static Set<String> extractSections(String content) {
        Set<String> sections = new LinkedHashSet<>();
        boolean inFence = false;
        for (String line : content.split("\\R")) {
            if (line.stripLeading().startsWith(FENCE)) {
                inFence = !inFence;
                continue;
            }
            if (inFence) {
                continue;
            }
            Matcher matcher = H2_PATTERN.matcher(line);
            if (matcher.matches()) {
                sections.add(DocumentType.normalize(matcher.group(1)));
            }
        }
        return sections;
    }
}
