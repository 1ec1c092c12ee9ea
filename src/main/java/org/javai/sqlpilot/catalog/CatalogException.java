package org.javai.sqlpilot.catalog;

/**
 * Raised when a catalog cannot be loaded, stored, discovered or fails structural validation.
 */
public class CatalogException extends RuntimeException {

	public CatalogException(String message) {
		super(message);
	}

	public CatalogException(String message, Throwable cause) {
		super(message, cause);
	}
}
