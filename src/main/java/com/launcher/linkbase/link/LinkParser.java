package com.launcher.linkbase.link;

import java.nio.file.Path;

import com.launcher.linkbase.locale.LocaleSelector;

/**
 * Turns a launcher description file into a {@link Link}.
 */
@FunctionalInterface
public interface LinkParser {

    /**
     * Parse one file. The returned link carries a single reference owned by the caller.
     *
     * @throws LinkParseException if the file cannot be read or is not a usable description
     */
    Link parse(Path file, LocaleSelector locale) throws LinkParseException;
}
