package com.cpparchitect.core.generator;

/**
 * Where a sanitized text ends up.
 */
public enum SanitizationContext {
    /** Node labels, activity texts, case labels, titles */
    LABEL,

    /** Branch, loop and switch conditions */
    CONDITION,

    /** Output file names; alphanumerics and underscore only */
    FILENAME
}
