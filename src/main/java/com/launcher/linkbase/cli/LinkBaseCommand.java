package com.launcher.linkbase.cli;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.launcher.linkbase.cli.exception.OptionsValidationException;
import com.launcher.linkbase.cli.model.ListOptions;
import com.launcher.linkbase.cli.model.ValidatedListOptions;
import com.launcher.linkbase.cli.output.LinkListingPrinter;
import com.launcher.linkbase.cli.validation.ListOptionsValidator;
import com.launcher.linkbase.core.LinkBase;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that indexes the launchers in the data directories and lists
 * them by category, optionally following changes.
 */
@Command(
        name = "linkbase",
        mixinStandardHelpOptions = true,
        version = "linkbase 1.0.0",
        description = "Indexes freedesktop launcher entries across the data directories and lists them by category."
)
public class LinkBaseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LinkBaseCommand.class);

    @Mixin
    private ListOptions options = new ListOptions();

    private final Map<String, String> environment;
    private final ListOptionsValidator validator = new ListOptionsValidator();
    private final LinkListingPrinter printer = new LinkListingPrinter();

    public LinkBaseCommand() {
        this(System.getenv());
    }

    public LinkBaseCommand(Map<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public Integer call() {
        try {
            ValidatedListOptions v = validator.validate(options, environment);
            printer.printBanner(v, v.getConfig().dataPaths(environment).dataDirs());

            try (LinkBase linkBase = LinkBase.fromConfig(v.getConfig(), environment)) {
                if (v.getCategory() != null) {
                    printer.printCategory(v.getCategory(), linkBase.lookupCategory(v.getCategory()));
                } else {
                    printer.printAll(linkBase);
                }

                if (v.isFollow()) {
                    linkBase.setUpdateListener((lb, kind, link) -> printer.printUpdate(kind, link));
                    log.info("Following changes, press Ctrl+C to stop");
                    new CountDownLatch(1).await();
                }
            }
            return 0;

        } catch (OptionsValidationException e) {
            printer.printFailure(e.getErrors());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 0;
        } catch (Exception e) {
            log.error("Listing failed with exception", e);
            return 1;
        }
    }
}
