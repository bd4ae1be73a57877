package my.sitescreener.app.service;

/**
 * The fact source could not answer. Callers treat this as recoverable: the affected candidate is
 * left unresolved and picked up again on the next attempt.
 */
public class ProviderUnavailableException extends RuntimeException {
	private final String key;

	public ProviderUnavailableException(String key, String message, Throwable cause) {
		super(message, cause);
		this.key = key;
	}

	public String getKey() {
		return key;
	}
}
