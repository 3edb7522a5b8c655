/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.common.impl;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Caches one value per {@link TypeSignature}, holding the values weakly: an
 * entry disappears once nothing else references its value, and a later
 * lookup creates a fresh one.
 *
 * @param <V> the cached value type
 */
public final class SpecializationCache<V> {

	private final ConcurrentMap<TypeSignature, Entry<V>> entries = new ConcurrentHashMap<>();
	private final ReferenceQueue<V> queue = new ReferenceQueue<>();

	/**
	 * The value cached for the signature, or a value created by the factory
	 * and cached, if none is reachable. The factory is called at most once
	 * per missing entry and may throw, in which case nothing is cached.
	 */
	public V computeIfAbsent(TypeSignature signature, Function<TypeSignature, V> factory) {
		expungeStaleEntries();
		final V cached = get( signature );
		if ( cached != null ) {
			return cached;
		}
		synchronized ( this ) {
			final V existing = get( signature );
			if ( existing != null ) {
				return existing;
			}
			final V created = factory.apply( signature );
			entries.put( signature, new Entry<>( signature, created, queue ) );
			return created;
		}
	}

	/**
	 * @return the cached value, or {@code null} if there is none or it has
	 * been reclaimed
	 */
	public V get(TypeSignature signature) {
		final Entry<V> entry = entries.get( signature );
		return entry == null ? null : entry.get();
	}

	/**
	 * The number of entries, reclaimed ones that were not purged yet included.
	 */
	public int size() {
		expungeStaleEntries();
		return entries.size();
	}

	private void expungeStaleEntries() {
		Reference<? extends V> reference;
		while ( ( reference = queue.poll() ) != null ) {
			final Entry<?> entry = (Entry<?>) reference;
			entries.remove( entry.signature, entry );
		}
	}

	private static final class Entry<V> extends WeakReference<V> {
		private final TypeSignature signature;

		private Entry(TypeSignature signature, V value, ReferenceQueue<V> queue) {
			super( value, queue );
			this.signature = signature;
		}
	}
}
