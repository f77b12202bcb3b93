package com.gateway.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.gateway.generator.cli.exception.OptionsValidationException;
import com.gateway.generator.cli.model.GenerateOptions;
import com.gateway.generator.cli.model.ValidatedGenerateOptions;
import com.gateway.generator.codegen.exception.GenerationException;
import com.gateway.generator.codegen.path.PathConfig;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getDescriptorSet() == null) {
			errors.add("Descriptor set is required (--descriptor-set / -d).");
		} else if (!Files.isRegularFile(o.getDescriptorSet())) {
			errors.add("Descriptor set does not exist or is not a file: " + o.getDescriptorSet());
		}

		// Unknown --paths values and --module/--paths conflicts are both reported here,
		// before any file is processed
		PathConfig pathConfig = null;
		try {
			pathConfig = PathConfig.fromFlags(o.getPaths(), o.getModule());
		} catch (GenerationException e) {
			errors.add(e.getMessage());
		}

		for (String file : o.getFiles()) {
			if (isBlank(file)) {
				errors.add("Empty value for --file.");
			}
		}

		Map<String, String> overrides = new LinkedHashMap<>();
		o.getGoPackageOverrides().forEach((file, importPath) -> {
			if (isBlank(file) || isBlank(importPath)) {
				errors.add("Invalid -M override '" + file + "=" + importPath + "': want -M<file>=<import path>.");
			} else {
				overrides.put(file.trim(), importPath.trim());
			}
		});

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();
		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(normalizedOutputDir, pathConfig, overrides);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
