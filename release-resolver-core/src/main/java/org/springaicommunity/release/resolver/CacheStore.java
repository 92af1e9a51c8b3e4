package org.springaicommunity.release.resolver;

import java.util.Collection;
import java.util.List;

/**
 * Persistence of {@link ResponseCache} contents across processes.
 *
 * <p>
 * Abstracts file system operations to enable testability and alternative storage
 * implementations.
 */
public interface CacheStore {

	/**
	 * Load previously saved entries.
	 * @return entries, empty if nothing was saved yet
	 */
	List<CacheEntry> load();

	/**
	 * Replace the saved entries.
	 * @param entries entries to save
	 */
	void save(Collection<CacheEntry> entries);

}
