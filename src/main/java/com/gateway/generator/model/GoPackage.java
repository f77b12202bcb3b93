package com.gateway.generator.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A Go package identified by its import path.
 *
 * Two packages are the same package when their import paths match; the name
 * and alias only affect how the package is referenced in generated source.
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class GoPackage {

    /**
     * Import path, e.g. {@code example.com/foo/bar}. May be empty when the
     * file declares no go_package.
     */
    @NonNull
    @EqualsAndHashCode.Include
    String path;

    /**
     * Package name used in the package clause.
     */
    @NonNull
    String name;

    /**
     * Optional import alias; empty when the package is imported by its name.
     */
    @NonNull
    @Builder.Default
    String alias = "";

    public static GoPackage of(String path) {
        return GoPackage.builder().path(path).name(defaultName(path)).build();
    }

    public static GoPackage of(String path, String name) {
        return GoPackage.builder().path(path).name(name).build();
    }

    /**
     * Parses a go_package option value: either {@code import/path} or
     * {@code import/path;name}.
     */
    public static GoPackage parse(String goPackageOption) {
        if (goPackageOption == null || goPackageOption.isBlank()) {
            return of("");
        }
        String value = goPackageOption.trim();
        int semicolon = value.indexOf(';');
        if (semicolon < 0) {
            return of(value);
        }
        return of(value.substring(0, semicolon), value.substring(semicolon + 1));
    }

    /**
     * Name under which generated code refers to this package.
     */
    public String getReferenceName() {
        return alias.isEmpty() ? name : alias;
    }

    static String defaultName(String path) {
        if (path.isEmpty()) {
            return "";
        }
        String base = path.substring(path.lastIndexOf('/') + 1);
        return base.replace('.', '_').replace('-', '_');
    }
}
