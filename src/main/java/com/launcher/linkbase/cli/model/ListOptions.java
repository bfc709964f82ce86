package com.launcher.linkbase.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.launcher.linkbase.link.LinkEnvironment;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options of the {@code linkbase} command. No validation, no execution logic, no printing.
 */
@Getter
public class ListOptions {

    @Option(names = { "--locale", "-l" },
            description = "Locale used for localized names (default: LC_ALL, LC_MESSAGES or LANG)")
    private String locale;

    @Option(names = { "--environment", "-E" },
            description = "Active desktop environment, repeatable: ${COMPLETION-CANDIDATES}")
    private List<LinkEnvironment> environments = new ArrayList<>();

    @Option(names = { "--data-dir", "-d" },
            description = "Data directory to search, repeatable, highest precedence first (default: XDG data dirs)")
    private List<Path> dataDirs = new ArrayList<>();

    @Option(names = { "--category", "-c" }, description = "Only list applications in this category")
    private String category;

    @Option(names = { "--follow", "-f" }, description = "Keep running and report every added or removed link")
    private boolean follow;
}
