package com.launcher.linkbase;

import com.launcher.linkbase.cli.LinkBaseCommand;
import picocli.CommandLine;

/**
 * Starts the {@code linkbase} command.
 *
 * <p>The command indexes every {@code .desktop} launcher under
 * {@code <data dir>/applications}, where an earlier data directory shadows
 * later ones for the same desktop file id. It lists the displayable
 * applications by category. With {@code --follow} it keeps watching and
 * logs each launcher as it is added or removed. Environment names given
 * to {@code --environment} are matched case-insensitively.
 */
public class LinkBaseApplication {

    public static void main(String[] args) {
        CommandLine commandLine = new CommandLine(new LinkBaseCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
        System.exit(commandLine.execute(args));
    }
}
