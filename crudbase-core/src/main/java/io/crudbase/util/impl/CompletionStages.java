/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.util.impl;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

public class CompletionStages {

	// singleton instances:
	private static final CompletionStage<Void> VOID = CompletableFuture.completedFuture( null );

	public static CompletionStage<Void> voidFuture() {
		return VOID;
	}

	public static <T> CompletionStage<T> nullFuture() {
		//Unsafe cast, but perfectly fine: avoids having to allocate a new instance
		//for each different "type of null".
		return (CompletionStage<T>) VOID;
	}

	public static <T> CompletionStage<T> failedFuture(Throwable t) {
		return CompletableFuture.failedFuture( t );
	}

	/**
	 * Turns an exception thrown by the supplier into a failed stage, so
	 * that callers only ever see failures through the returned stage.
	 */
	public static <T> CompletionStage<T> supplyStage(Supplier<CompletionStage<T>> supplier) {
		try {
			return supplier.get();
		}
		catch (RuntimeException e) {
			return failedFuture( e );
		}
	}

	/**
	 * The exception a stage failed with, without the
	 * {@link CompletionException} that {@code thenCompose} chains add.
	 */
	public static Throwable unwrap(Throwable t) {
		return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
	}
}
