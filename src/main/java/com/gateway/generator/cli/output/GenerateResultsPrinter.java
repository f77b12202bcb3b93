package com.gateway.generator.cli.output;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gateway.generator.cli.model.GenerateOptions;
import com.gateway.generator.cli.model.ValidatedGenerateOptions;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution, no prompting.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("gRPC Gateway Generator");
        log.info("=================================================");
        log.info("Descriptor Set: {}", o.getDescriptorSet().toAbsolutePath());
        log.info("Target Files: {}", o.getFiles().isEmpty() ? "All files declaring a service" : o.getFiles());
        log.info("Paths: {}", v.getPathConfig().getAddressingMode().getFlag());
        log.info("Module: {}", v.getPathConfig().hasModulePrefix() ? v.getPathConfig().getModulePrefix() : "None");
        log.info("Register Func Suffix: {}", o.getRegisterFuncSuffix());
        log.info("Request Context: {}", o.isRequestContext());
        log.info("Allow Patch Feature: {}", o.isAllowPatchFeature());
        log.info("Standalone: {}", o.isStandalone());
        log.info("Omit Package Doc: {}", o.isOmitPackageDoc());
        if (!v.getGoPackageOverrides().isEmpty()) {
            log.info("Go Package Overrides:");
            v.getGoPackageOverrides().forEach((file, path) -> log.info("  {} -> {}", file, path));
        }
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("=================================================");
    }

    public void printSuccess(ValidatedGenerateOptions v, int targetCount, List<Path> written) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Files Considered: {}", targetCount);
        log.info("Gateway Files Written: {}", written.size());
        log.info("Files Skipped (no HTTP bindings): {}", targetCount - written.size());
        for (Path path : written) {
            log.info("  {}", v.getNormalizedOutputDir().relativize(path));
        }
        log.info("=================================================");
    }

    public void printErrors(List<String> errors) {
        log.error("Invalid options:");
        for (String error : errors) {
            log.error("  - {}", error);
        }
    }
}
