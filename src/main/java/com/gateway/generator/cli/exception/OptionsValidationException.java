package com.gateway.generator.cli.exception;

import java.util.List;

/**
 * Thrown when the generate options are unusable, e.g. a missing descriptor set
 * or --module combined with --paths=source_relative. Carries every problem found
 * so they can be reported in one go, before any descriptor is loaded.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(errors.size() == 1 ? errors.get(0)
				: errors.size() + " invalid options:" + System.lineSeparator()
						+ String.join(System.lineSeparator(), errors));
		this.errors = List.copyOf(errors);
	}

	/**
	 * @return the individual problems, in the order they were detected
	 */
	public List<String> getErrors() {
		return errors;
	}
}
