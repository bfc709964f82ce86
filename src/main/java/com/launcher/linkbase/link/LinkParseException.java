package com.launcher.linkbase.link;

import java.nio.file.Path;

/**
 * A launcher description that could not be turned into a {@link Link}:
 * unreadable, malformed, missing required keys or marked hidden.
 */
public class LinkParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final transient Path path;

    public LinkParseException(Path path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public LinkParseException(Path path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
