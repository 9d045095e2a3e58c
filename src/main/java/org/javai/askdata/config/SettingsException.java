package org.javai.askdata.config;

/**
 * Thrown when configuration cannot be read or holds an invalid value.
 */
public class SettingsException extends RuntimeException {

	public SettingsException(String message) {
		super(message);
	}

	public SettingsException(String message, Throwable cause) {
		super(message, cause);
	}
}
