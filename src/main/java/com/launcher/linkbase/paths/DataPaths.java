package com.launcher.linkbase.paths;

import java.nio.file.Path;
import java.util.List;

/**
 * Ordered base directories to look for data in. Earlier directories take precedence.
 */
public interface DataPaths {

    /**
     * Base data directories in search order. The list is read once per
     * registration pass; later changes are not observed.
     */
    List<Path> dataDirs();
}
