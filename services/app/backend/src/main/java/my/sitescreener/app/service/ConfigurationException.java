package my.sitescreener.app.service;

/**
 * Raised when a run cannot be set up from the given filter criteria or configuration.
 * Nothing is persisted when this is thrown.
 */
public class ConfigurationException extends RuntimeException {
	public ConfigurationException(String message) {
		super(message);
	}
}
