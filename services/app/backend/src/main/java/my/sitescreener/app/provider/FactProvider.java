package my.sitescreener.app.provider;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read-only source of the facts the screening core consumes. Implementations own caching,
 * rate limiting and retries; the core only sees a record, an empty record, or
 * {@link ProviderUnavailableException}.
 */
public interface FactProvider {
	/**
	 * Candidate keys of the reference catalog in the given states, sorted.
	 */
	List<String> findCandidateKeys(Collection<String> states);

	/**
	 * Catalog rows for the given keys. Keys missing from the catalog are absent from the result.
	 */
	Map<String, CatalogEntry> catalogEntries(Collection<String> zips);

	/**
	 * Stage facts for one candidate. Returns {@link FactRecord#noData(String)} when nothing is
	 * known about the key.
	 */
	FactRecord lookupCandidate(String zip, FactSet factSet);

	/**
	 * Market, feasibility, trajectory, catalyst and jurisdiction facts for one county.
	 */
	FactRecord lookupAggregate(String countyFips);
}
