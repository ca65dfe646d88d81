package io.prism.diff;

import java.util.Iterator;

/**
 * Single-pass stream of comparison events that may hold backend resources. Closing it releases them
 * whether or not the stream was consumed to the end.
 */
public interface ComparisonStream extends Iterator<ComparisonEvent>, AutoCloseable {

	@Override
	void close();
}
