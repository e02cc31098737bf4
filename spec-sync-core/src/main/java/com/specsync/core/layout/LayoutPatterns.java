package com.specsync.core.layout;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.specsync.core.model.FileKind;

/**
 * Path templates per artifact kind.
 *
 * <p>Templates may use {@code {path}} (the underscored module path, such as
 * {@code my_app/accounts}) and {@code {project}} (the underscored project module).
 * Null entries fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * layout:
 *   spec: "docs/spec/{path}.spec.md"
 *   code: "lib/{path}.ex"
 *   test: "test/{path}_test.exs"
 *   review: "docs/design/{path}/design_review.md"
 *   design: "docs/design/{path}.md"
 *   reviewForContextsOnly: true
 * }</pre>
 *
 * @param spec specification file template
 * @param code implementation file template
 * @param test test file template
 * @param review design review template
 * @param design design document template
 * @param reviewForContextsOnly whether only context types have a review file
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LayoutPatterns(
    @JsonProperty("spec") String spec,
    @JsonProperty("code") String code,
    @JsonProperty("test") String test,
    @JsonProperty("review") String review,
    @JsonProperty("design") String design,
    @JsonProperty("reviewForContextsOnly") Boolean reviewForContextsOnly
) {

    public static final String DEFAULT_SPEC = "docs/spec/{path}.spec.md";
    public static final String DEFAULT_CODE = "lib/{path}.ex";
    public static final String DEFAULT_TEST = "test/{path}_test.exs";
    public static final String DEFAULT_REVIEW = "docs/design/{path}/design_review.md";
    public static final String DEFAULT_DESIGN = "docs/design/{path}.md";

    public LayoutPatterns {
        spec = spec == null ? DEFAULT_SPEC : spec;
        code = code == null ? DEFAULT_CODE : code;
        test = test == null ? DEFAULT_TEST : test;
        review = review == null ? DEFAULT_REVIEW : review;
        design = design == null ? DEFAULT_DESIGN : design;
        reviewForContextsOnly = reviewForContextsOnly == null ? Boolean.TRUE : reviewForContextsOnly;
    }

    public static LayoutPatterns defaults() {
        return new LayoutPatterns(null, null, null, null, null, null);
    }

    public String template(FileKind kind) {
        return switch (kind) {
            case SPEC -> spec;
            case CODE -> code;
            case TEST -> test;
            case REVIEW -> review;
            case DESIGN -> design;
        };
    }
}
