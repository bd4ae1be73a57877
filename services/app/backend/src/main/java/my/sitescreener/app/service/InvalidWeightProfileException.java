package my.sitescreener.app.service;

import java.util.List;

public class InvalidWeightProfileException extends RuntimeException {
	private final List<String> errors;

	public InvalidWeightProfileException(List<String> errors) {
		super("Weight profile validation failed: " + String.join("; ", errors));
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}
}
