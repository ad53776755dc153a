package com.shipyard.core.tagging;

import com.shipyard.core.model.ArtifactTag;
import com.shipyard.core.model.DerivedTags;

import java.util.Locale;

/**
 * Derives the registry tags for a build from its ref and commit.
 * <p>
 * The same instance is used when publishing and when pulling, so both phases
 * always agree on the spelling of the mutable tag. Ref names are never
 * interpreted: a branch name and a pull-request merge ref go through the
 * same sanitization.
 */
public class TagDeriver {

    public static final int DEFAULT_MAX_LENGTH = 128;
    public static final String DEFAULT_PLACEHOLDER = "unknown-ref";

    private final String registry;
    private final String namespace;
    private final String repository;
    private final int maxLength;
    private final String placeholder;

    public TagDeriver(String registry, String namespace, String repository) {
        this(registry, namespace, repository, DEFAULT_MAX_LENGTH, DEFAULT_PLACEHOLDER);
    }

    public TagDeriver(String registry, String namespace, String repository,
                      int maxLength, String placeholder) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("Tag max length must be positive: " + maxLength);
        }
        this.registry = registry;
        this.namespace = namespace.toLowerCase(Locale.ROOT);
        this.repository = repository.toLowerCase(Locale.ROOT);
        this.maxLength = maxLength;
        // The placeholder must itself be a valid tag, so run it through the same rules.
        String cleanPlaceholder = sanitize(placeholder, maxLength);
        this.placeholder = cleanPlaceholder.isEmpty() ? DEFAULT_PLACEHOLDER : cleanPlaceholder;
    }

    /**
     * Computes the mutable (per-ref) and immutable (per-commit) tags.
     *
     * @param refName  branch or merge ref, may be {@code null}
     * @param commitId commit identifier, used verbatim as the immutable tag
     */
    public DerivedTags deriveTags(String refName, String commitId) {
        return new DerivedTags(mutableTag(refName), immutableTag(commitId));
    }

    public ArtifactTag mutableTag(String refName) {
        String tag = sanitize(refName);
        return tagged(tag.isEmpty() ? placeholder : tag);
    }

    public ArtifactTag immutableTag(String commitId) {
        if (commitId == null || commitId.isBlank()) {
            throw new IllegalArgumentException("Commit identifier is required to derive the immutable tag");
        }
        return tagged(commitId);
    }

    /**
     * Sanitizes a ref into a registry-safe tag token using this deriver's max length.
     */
    public String sanitize(String refName) {
        return sanitize(refName, maxLength);
    }

    /**
     * Total, deterministic and idempotent: lower-cases, replaces every character outside
     * {@code [a-z0-9._-]} with {@code -}, collapses runs of {@code -}, trims leading and
     * trailing {@code -} and truncates to {@code maxLength}. May return an empty string.
     */
    public static String sanitize(String refName, int maxLength) {
        if (refName == null) {
            return "";
        }
        String lower = refName.toLowerCase(Locale.ROOT);
        var sb = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            char out = isAllowed(c) ? c : '-';
            if (out == '-' && sb.length() > 0 && sb.charAt(sb.length() - 1) == '-') {
                continue;
            }
            sb.append(out);
        }
        String cleaned = trimDashes(sb.toString());
        if (cleaned.length() > maxLength) {
            cleaned = trimDashes(cleaned.substring(0, maxLength));
        }
        return cleaned;
    }

    private ArtifactTag tagged(String tag) {
        return new ArtifactTag(registry, namespace, repository, tag);
    }

    private static boolean isAllowed(char c) {
        return (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '.' || c == '_' || c == '-';
    }

    private static String trimDashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') start++;
        while (end > start && s.charAt(end - 1) == '-') end--;
        return s.substring(start, end);
    }
}
