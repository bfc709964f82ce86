package com.launcher.linkbase.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.launcher.linkbase.cli.exception.OptionsValidationException;
import com.launcher.linkbase.cli.model.ListOptions;
import com.launcher.linkbase.cli.model.ValidatedListOptions;
import com.launcher.linkbase.config.LinkBaseConfig;
import com.launcher.linkbase.locale.LocaleSelector;

public class ListOptionsValidator {

    public ValidatedListOptions validate(ListOptions o, Map<String, String> env) {
        List<String> errors = new ArrayList<>();

        String locale = o.getLocale();
        if (locale == null) {
            locale = LocaleSelector.fromEnvironment(env).toString();
        } else if (LocaleSelector.parse(locale).getLanguage().isEmpty()) {
            errors.add("Locale must start with a language, e.g. en_US.UTF-8. Got: '" + locale + "'");
        }

        // Missing data dirs are fine (nothing gets indexed from them), regular files are not
        for (Path dir : o.getDataDirs()) {
            if (Files.exists(dir) && !Files.isDirectory(dir)) {
                errors.add("Data directory is not a directory: " + dir);
            }
        }

        if (o.getCategory() != null && o.getCategory().isBlank()) {
            errors.add("Category must not be blank (--category / -c).");
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        LinkBaseConfig config = LinkBaseConfig.builder()
                .locale(locale)
                .environments(o.getEnvironments())
                .dataDirs(o.getDataDirs().stream().map(p -> p.toAbsolutePath().normalize()).toList())
                .build();

        return new ValidatedListOptions(config, o.getCategory() == null ? null : o.getCategory().trim(), o.isFollow());
    }
}
