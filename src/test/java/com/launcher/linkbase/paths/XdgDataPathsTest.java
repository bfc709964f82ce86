package com.launcher.linkbase.paths;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for XdgDataPaths.
 */
class XdgDataPathsTest {

    @Test
    void testDefaults() {
        XdgDataPaths paths = XdgDataPaths.fromEnvironment(Map.of("HOME", "/home/user"));

        assertThat(paths.dataDirs()).containsExactly(
                Path.of("/home/user/.local/share"),
                Path.of("/usr/local/share"),
                Path.of("/usr/share"));
    }

    @Test
    void testEnvironmentOverrides() {
        XdgDataPaths paths = XdgDataPaths.fromEnvironment(Map.of(
                "HOME", "/home/user",
                "XDG_DATA_HOME", "/data/home",
                "XDG_DATA_DIRS", "/opt/share::/usr/share:"));

        assertThat(paths.dataDirs()).containsExactly(
                Path.of("/data/home"),
                Path.of("/opt/share"),
                Path.of("/usr/share"));
    }

    @Test
    void testDuplicatesKeptOnceInFirstPosition() {
        XdgDataPaths paths = XdgDataPaths.fromEnvironment(Map.of(
                "XDG_DATA_HOME", "/usr/share",
                "XDG_DATA_DIRS", "/usr/local/share:/usr/share/"));

        assertThat(paths.dataDirs()).containsExactly(Path.of("/usr/share"), Path.of("/usr/local/share"));
    }

    @Test
    void testExplicitList() {
        XdgDataPaths paths = XdgDataPaths.of(List.of(Path.of("/b"), Path.of("/a"), Path.of("/b")));

        assertThat(paths.dataDirs()).containsExactly(Path.of("/b"), Path.of("/a"));
    }
}
