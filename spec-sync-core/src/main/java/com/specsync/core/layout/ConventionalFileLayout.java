package com.specsync.core.layout;

import com.specsync.core.model.Component;
import com.specsync.core.model.FileKind;
import com.specsync.core.model.ProjectInfo;
import com.specsync.core.util.ModuleNames;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves artifact paths by substituting a component's module path into {@link LayoutPatterns}.
 *
 * <p>With the default patterns, {@code MyApp.Accounts} resolves to:
 * <ul>
 *   <li>spec: {@code docs/spec/my_app/accounts.spec.md}</li>
 *   <li>code: {@code lib/my_app/accounts.ex}</li>
 *   <li>test: {@code test/my_app/accounts_test.exs}</li>
 *   <li>review: {@code docs/design/my_app/accounts/design_review.md} (context types only)</li>
 * </ul>
 */
public class ConventionalFileLayout implements FileLayoutResolver {

    private final LayoutPatterns patterns;

    public ConventionalFileLayout() {
        this(LayoutPatterns.defaults());
    }

    public ConventionalFileLayout(LayoutPatterns patterns) {
        this.patterns = Objects.requireNonNull(patterns, "patterns must not be null");
    }

    @Override
    public Optional<String> pathFor(Component component, ProjectInfo project, FileKind kind) {
        if (kind == FileKind.REVIEW && patterns.reviewForContextsOnly() && !component.type().isContext()) {
            return Optional.empty();
        }
        String path = patterns.template(kind)
            .replace("{path}", ModuleNames.toPath(component.moduleName()))
            .replace("{project}", ModuleNames.toPath(project.moduleName()));
        return Optional.of(path);
    }
}
