package org.javai.sqlpilot.reduce;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.javai.sqlpilot.catalog.CatalogColumn;
import org.javai.sqlpilot.catalog.CatalogTable;
import org.javai.sqlpilot.catalog.SchemaCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the part of a catalog that is relevant to a question.
 *
 * <p>A catalog with at most {@code maxTables} tables is returned as is. Larger catalogs are scored lexically:
 * every question term found in a table's name counts {@value #NAME_WEIGHT}, in its alias
 * {@value #ALIAS_WEIGHT}, in its description {@value #DESCRIPTION_WEIGHT}, and each column whose name or
 * description shares a term counts {@value #COLUMN_WEIGHT}. The top {@code maxTables} tables are kept, ties going
 * to the table declared first, and only relationships between kept tables survive.</p>
 *
 * <p>Reductions are cached per catalog snapshot and question. A refreshed catalog is a new snapshot, so stale
 * entries are never served for it.</p>
 */
public final class SchemaContextReducer {

	private static final Logger logger = LoggerFactory.getLogger(SchemaContextReducer.class);

	static final int NAME_WEIGHT = 3;
	static final int ALIAS_WEIGHT = 2;
	static final int DESCRIPTION_WEIGHT = 1;
	static final int COLUMN_WEIGHT = 1;

	private final int maxTables;
	private final Cache<ReductionKey, SchemaCatalog> reductions;

	public SchemaContextReducer(int maxTables) {
		this(maxTables, 512);
	}

	public SchemaContextReducer(int maxTables, int cacheCapacity) {
		if (maxTables < 1) {
			throw new IllegalArgumentException("maxTables must be >= 1");
		}
		this.maxTables = maxTables;
		this.reductions = Caffeine.newBuilder()
				.maximumSize(cacheCapacity)
				.executor(Runnable::run)
				.build();
	}

	/**
	 * @return the reduced catalog; empty if the catalog is empty
	 */
	public SchemaCatalog reduce(String question, SchemaCatalog catalog) {
		if (catalog == null || catalog.isEmpty()) {
			return SchemaCatalog.empty();
		}
		if (catalog.size() <= maxTables) {
			return catalog;
		}
		ReductionKey key = new ReductionKey(catalog, QuestionTerms.fingerprint(question));
		return reductions.get(key, k -> score(question, catalog));
	}

	/**
	 * Number of tables in the catalog that share at least one term with the question.
	 */
	public int countRelevantTables(String question, SchemaCatalog catalog) {
		Set<String> terms = QuestionTerms.ofQuestion(question);
		return (int) catalog.tables().stream()
				.filter(table -> relevance(table, terms) > 0)
				.count();
	}

	public void invalidateAll() {
		reductions.invalidateAll();
	}

	private SchemaCatalog score(String question, SchemaCatalog catalog) {
		Set<String> terms = QuestionTerms.ofQuestion(question);
		List<ScoredTable> scored = new ArrayList<>();
		List<CatalogTable> tables = catalog.tables();
		for (int i = 0; i < tables.size(); i++) {
			scored.add(new ScoredTable(tables.get(i), relevance(tables.get(i), terms), i));
		}
		List<CatalogTable> kept = scored.stream()
				.sorted(Comparator.comparingInt(ScoredTable::score).reversed()
						.thenComparingInt(ScoredTable::position))
				.limit(maxTables)
				.map(ScoredTable::table)
				.toList();
		SchemaCatalog reduced = catalog.restrictTo(kept);
		logger.debug("Reduced {} tables to {} for terms {}", catalog.size(), reduced.tables().stream()
				.map(CatalogTable::name).toList(), terms);
		return reduced;
	}

	static int relevance(CatalogTable table, Set<String> terms) {
		if (terms.isEmpty()) {
			return 0;
		}
		int score = NAME_WEIGHT * overlap(QuestionTerms.ofName(table.name()), terms)
				+ ALIAS_WEIGHT * overlap(QuestionTerms.ofName(table.alias()), terms)
				+ DESCRIPTION_WEIGHT * overlap(QuestionTerms.ofQuestion(table.description()), terms);
		for (CatalogColumn column : table.columns()) {
			if (overlap(QuestionTerms.ofName(column.name()), terms) > 0
					|| overlap(QuestionTerms.ofQuestion(column.description()), terms) > 0) {
				score += COLUMN_WEIGHT;
			}
		}
		return score;
	}

	private static int overlap(Set<String> candidate, Set<String> terms) {
		int count = 0;
		for (String term : candidate) {
			if (terms.contains(term)) {
				count++;
			}
		}
		return count;
	}

	private record ScoredTable(CatalogTable table, int score, int position) {
	}

	private record ReductionKey(SchemaCatalog catalog, String question) {
	}
}
