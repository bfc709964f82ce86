package com.launcher.linkbase.cli.validation;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.launcher.linkbase.cli.exception.OptionsValidationException;
import com.launcher.linkbase.cli.model.ListOptions;
import com.launcher.linkbase.cli.model.ValidatedListOptions;
import com.launcher.linkbase.link.LinkEnvironment;

import picocli.CommandLine;

/**
 * Unit tests for ListOptionsValidator.
 */
class ListOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final ListOptionsValidator validator = new ListOptionsValidator();

    private static ListOptions parse(String... args) {
        ListOptions options = new ListOptions();
        new CommandLine(options).setCaseInsensitiveEnumValuesAllowed(true).parseArgs(args);
        return options;
    }

    @Test
    void testValidOptions() {
        ListOptions options = parse("-l", "fr_FR.UTF-8", "-E", "openbox", "-E", "GNOME",
                "-d", tempDir.toString(), "-c", " Utility ", "-f");

        ValidatedListOptions v = validator.validate(options, Map.of());

        assertThat(v.getConfig().getLocale()).isEqualTo("fr_FR.UTF-8");
        assertThat(v.getConfig().getEnvironments()).containsExactlyInAnyOrder(LinkEnvironment.OPENBOX, LinkEnvironment.GNOME);
        assertThat(v.getConfig().environmentMask()).isEqualTo(0b11);
        assertThat(v.getConfig().getDataDirs()).containsExactly(tempDir.toAbsolutePath().normalize());
        assertThat(v.getCategory()).isEqualTo("Utility");
        assertThat(v.isFollow()).isTrue();
    }

    @Test
    void testLocaleDefaultsToEnvironment() {
        ValidatedListOptions v = validator.validate(parse(), Map.of("LANG", "de_DE.UTF-8"));

        assertThat(v.getConfig().getLocale()).isEqualTo("de_DE");
        assertThat(v.getConfig().getDataDirs()).isEmpty();
        assertThat(v.getCategory()).isNull();
        assertThat(v.isFollow()).isFalse();
    }

    @Test
    void testMissingDataDirectoryAccepted() {
        Path missing = tempDir.resolve("missing");

        ValidatedListOptions v = validator.validate(parse("-d", missing.toString()), Map.of());

        assertThat(v.getConfig().getDataDirs()).containsExactly(missing.toAbsolutePath().normalize());
    }

    @Test
    void testAllErrorsReported() throws IOException {
        Path file = Files.writeString(tempDir.resolve("not-a-dir"), "");

        ListOptions options = parse("-l", "_US", "-d", file.toString(), "-c", " ");

        assertThatThrownBy(() -> validator.validate(options, Map.of()))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors())
                        .hasSize(3)
                        .anySatisfy(error -> assertThat(error).contains("language"))
                        .anySatisfy(error -> assertThat(error).contains("not a directory"))
                        .anySatisfy(error -> assertThat(error).contains("Category")));
    }
}
