package io.prism.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Side of a diff a location refers to.
 */
public enum DiffSide {

	/**
	 * The base ("left", older) side.
	 */
	@JsonProperty("base")
	BASE,

	/**
	 * The head ("right", reviewed) side.
	 */
	@JsonProperty("head")
	HEAD
}
