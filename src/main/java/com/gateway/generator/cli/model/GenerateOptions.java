package com.gateway.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--descriptor-set", "-d" }, required = true,
			description = "FileDescriptorSet written by protoc --include_imports --descriptor_set_out")
	private Path descriptorSet;

	@Option(names = { "--file", "-f" },
			description = "Proto file to generate for (repeatable). Defaults to every file declaring a service")
	private List<String> files = new ArrayList<>();

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--paths" }, defaultValue = "import",
			description = "Output addressing: import or source_relative (default: ${DEFAULT-VALUE})")
	private String paths;

	@Option(names = { "--module" }, defaultValue = "",
			description = "Go module prefix to strip from output paths (requires --paths=import)")
	private String module;

	@Option(names = { "--register-func-suffix" }, defaultValue = "Handler",
			description = "Suffix of generated Register functions (default: ${DEFAULT-VALUE})")
	private String registerFuncSuffix;

	@Option(names = { "--request-context" }, negatable = true, defaultValue = "true", fallbackValue = "true",
			description = "Use the HTTP request context instead of the registration context")
	private boolean requestContext;

	@Option(names = { "--allow-patch-feature" }, negatable = true, defaultValue = "true", fallbackValue = "true",
			description = "Populate update masks from PATCH request bodies")
	private boolean allowPatchFeature;

	@Option(names = { "--standalone" }, description = "Generate into a separate package importing the proto package")
	private boolean standalone;

	@Option(names = { "--omit-package-doc" }, description = "Omit the package documentation comment")
	private boolean omitPackageDoc;

	// -Mfoo/bar.proto=example.com/foo/bar
	@Option(names = { "-M" }, description = "Go import path override for a proto file: -M<file>=<import path>")
	private Map<String, String> goPackageOverrides = new LinkedHashMap<>();

}
