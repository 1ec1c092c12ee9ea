package org.javai.sqlpilot.exec;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.javai.sqlpilot.sql.SqlText;

/**
 * Cache key of an executed query.
 *
 * <p>The key is the SHA-256 hex digest of the normalised query text plus the row cap. Normalisation only removes
 * cosmetic differences (whitespace, letter case and comments outside literals and quoted identifiers), so two
 * queries that differ in a literal or in a quoted name never share an entry.</p>
 */
public final class QueryFingerprint {

	private QueryFingerprint() {
		// Utility class
	}

	public static String of(String query, int rowCap) {
		return sha256(SqlText.normalize(query) + "\u0000" + rowCap);
	}

	private static String sha256(String input) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
		} catch (NoSuchAlgorithmException e) {
			// SHA-256 is guaranteed to be available
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}
}
