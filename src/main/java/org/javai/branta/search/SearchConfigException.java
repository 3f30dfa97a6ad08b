package org.javai.branta.search;

/**
 * Thrown when a search configuration is invalid or cannot be loaded.
 */
public class SearchConfigException extends RuntimeException {

	public SearchConfigException(String message) {
		super(message);
	}

	public SearchConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
