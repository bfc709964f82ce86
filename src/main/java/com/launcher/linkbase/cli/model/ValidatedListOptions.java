package com.launcher.linkbase.cli.model;

import com.launcher.linkbase.config.LinkBaseConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Options after validation, with the locale resolved. Keeps LinkBaseCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedListOptions {
    LinkBaseConfig config;
    String category;
    boolean follow;
}
