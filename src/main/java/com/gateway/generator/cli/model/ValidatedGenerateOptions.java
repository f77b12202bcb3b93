package com.gateway.generator.cli.model;

import java.nio.file.Path;
import java.util.Map;

import com.gateway.generator.codegen.path.PathConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path normalizedOutputDir;
    PathConfig pathConfig;
    Map<String, String> goPackageOverrides;
}
