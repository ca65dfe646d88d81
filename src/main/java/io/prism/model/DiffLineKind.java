package io.prism.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Role a line plays inside a diff hunk.
 */
public enum DiffLineKind {

	/**
	 * Unchanged line present on both sides, shown for context.
	 */
	@JsonProperty("context")
	CONTEXT,

	/**
	 * Line that exists only on the head side.
	 */
	@JsonProperty("addition")
	ADDITION,

	/**
	 * Line that exists only on the base side.
	 */
	@JsonProperty("deletion")
	DELETION
}
