package io.prism.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Status of a file from the point of view of a diff between two revisions.
 */
public enum FileStatus {

	/**
	 * File only exists on the head side.
	 */
	@JsonProperty("added")
	ADDED,

	/**
	 * File only exists on the base side.
	 */
	@JsonProperty("deleted")
	DELETED,

	/**
	 * File exists on both sides with modifications.
	 */
	@JsonProperty("modified")
	MODIFIED,

	/**
	 * File path changed between base and head.
	 */
	@JsonProperty("renamed")
	RENAMED,

	/**
	 * File content was copied from another location.
	 */
	@JsonProperty("copied")
	COPIED,

	/**
	 * File type changed, for example a regular file replaced by a symbolic link.
	 */
	@JsonProperty("type_change")
	TYPE_CHANGE;

	/**
	 * Returns true if a diff file with this status may carry a distinct previous path.
	 *
	 * @return true for renamed and copied files
	 */
	public boolean hasOriginalPath() {
		return this == RENAMED || this == COPIED;
	}
}
