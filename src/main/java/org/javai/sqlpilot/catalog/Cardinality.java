package org.javai.sqlpilot.catalog;

/**
 * Cardinality of a relationship, read from source to target.
 */
public enum Cardinality {
	ONE_TO_ONE,
	ONE_TO_MANY,
	MANY_TO_ONE,
	MANY_TO_MANY
}
