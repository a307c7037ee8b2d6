package com.hired.core.content;

import java.util.Map;

/**
 * Supplies raw resume data as an ordered map of top-level keys.
 *
 * <p>How the data is produced (files, databases, generated drafts) is up to the
 * implementation; the rendering pipeline only relies on key order being
 * preserved.
 */
public interface ContentSource {

    /**
     * Reads the resume data.
     *
     * @return ordered top-level map
     * @throws IllegalStateException if the data cannot be read
     */
    Map<String, Object> read();

    /**
     * Describes where the data comes from, for log and error messages.
     *
     * @return short description
     */
    String describe();
}
