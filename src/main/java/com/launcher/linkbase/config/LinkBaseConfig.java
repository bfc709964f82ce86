package com.launcher.linkbase.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.launcher.linkbase.link.LinkEnvironment;
import com.launcher.linkbase.paths.DataPaths;
import com.launcher.linkbase.paths.XdgDataPaths;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Configuration for building a link base.
 */
@Data
@Builder
public class LinkBaseConfig {

    /** Locale specifier, e.g. {@code en_US.UTF-8}. */
    private String locale;

    @Singular
    private Set<LinkEnvironment> environments;

    /** Explicit data directories; when empty the XDG environment variables decide. */
    @Singular
    private List<Path> dataDirs;

    public int environmentMask() {
        return LinkEnvironment.mask(environments);
    }

    public DataPaths dataPaths(Map<String, String> env) {
        if (dataDirs.isEmpty()) {
            return XdgDataPaths.fromEnvironment(env);
        }
        return XdgDataPaths.of(dataDirs);
    }
}
