package com.hired.core.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/**
 * Core resume sections recognised by the rendering pipeline.
 *
 * <p>Keys follow the JSON Resume schema. Any top-level key that is neither a
 * section nor {@code basics} (or one of the {@link #IGNORED_KEYS}) is treated
 * as an {@link ExtraSection}.
 */
public enum ResumeSection {
    WORK("work", "Experience"),
    EDUCATION("education", "Education"),
    PROJECTS("projects", "Projects"),
    SKILLS("skills", "Skills"),
    VOLUNTEER("volunteer", "Volunteer"),
    AWARDS("awards", "Awards"),
    CERTIFICATES("certificates", "Certificates"),
    PUBLICATIONS("publications", "Publications"),
    LANGUAGES("languages", "Languages"),
    INTERESTS("interests", "Interests"),
    REFERENCES("references", "References");

    /** Top-level key holding the contact block. */
    public static final String BASICS_KEY = "basics";

    /** Schema bookkeeping keys that are neither rendered nor treated as extra sections. */
    public static final Set<String> IGNORED_KEYS = Set.of("meta", "field_schema");

    private final String key;
    private final String title;

    ResumeSection(String key, String title) {
        this.key = key;
        this.title = title;
    }

    /**
     * Returns the JSON Resume key of this section.
     *
     * @return section key, e.g. {@code work}
     */
    public String key() {
        return key;
    }

    /**
     * Returns the heading rendered above this section.
     *
     * @return display title
     */
    public String title() {
        return title;
    }

    /**
     * Whether this section has a dedicated layout in the bundled themes.
     * The remaining sections share a generic layout.
     *
     * @return true for work, education, projects and skills
     */
    public boolean hasDedicatedLayout() {
        return this == WORK || this == EDUCATION || this == PROJECTS || this == SKILLS;
    }

    /**
     * Looks up a section by its key.
     *
     * @param key top-level key
     * @return matching section, or empty for non-section keys
     */
    public static Optional<ResumeSection> fromKey(String key) {
        return Arrays.stream(values())
            .filter(section -> section.key.equals(key))
            .findFirst();
    }
}
