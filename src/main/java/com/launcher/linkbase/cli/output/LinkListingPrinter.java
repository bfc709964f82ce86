package com.launcher.linkbase.cli.output;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.launcher.linkbase.cli.model.ValidatedListOptions;
import com.launcher.linkbase.config.LinkBaseConfig;
import com.launcher.linkbase.core.LinkBase;
import com.launcher.linkbase.core.LinkBaseUpdateKind;
import com.launcher.linkbase.link.Link;

/**
 * Responsible only for printing CLI output for the "linkbase" command.
 * No validation, no execution.
 */
public class LinkListingPrinter {

    private static final Logger log = LoggerFactory.getLogger(LinkListingPrinter.class);

    private static final Comparator<Link> BY_NAME =
            Comparator.comparing(Link::getName, String.CASE_INSENSITIVE_ORDER);

    public void printBanner(ValidatedListOptions v, List<Path> dataDirs) {
        LinkBaseConfig config = v.getConfig();
        log.info("=================================================");
        log.info("Link Base");
        log.info("=================================================");
        log.info("Locale: {}", config.getLocale());
        log.info("Environments: {}", config.getEnvironments().isEmpty() ? "None" : config.getEnvironments());
        log.info("Data Directories:");
        for (Path dir : dataDirs) {
            log.info("  {}", dir);
        }
        log.info("Category: {}", v.getCategory() != null ? v.getCategory() : "All");
        log.info("=================================================");
    }

    public void printAll(LinkBase linkBase) {
        log.info("Desktop file ids: {}", linkBase.size());
        for (String category : linkBase.categories()) {
            printCategory(category, linkBase.lookupCategory(category));
        }
    }

    public void printCategory(String category, List<Link> links) {
        log.info("");
        log.info("[{}] ({} applications)", category, links.size());
        links.stream()
                .sorted(BY_NAME)
                .forEach(link -> log.info("  {}  ({})", link.getName(), link.getSourcePath()));
    }

    public void printUpdate(LinkBaseUpdateKind kind, Link link) {
        log.info("{} {} ({})", kind == LinkBaseUpdateKind.ADDED ? "+" : "-", link.getName(), link.getSourcePath());
    }

    public void printFailure(List<String> errors) {
        for (String error : errors) {
            log.error(error);
        }
    }
}
