package io.prism.model;

/**
 * Line ranges referenced by a hunk header.
 *
 * The header format is: @@ -baseStart,baseLines +headStart,headLines @@
 *
 * @param baseStart starting line on the base side (1-based, 0 for an empty range at file start)
 * @param baseLines number of base lines covered by the hunk
 * @param headStart starting line on the head side (1-based, 0 for an empty range at file start)
 * @param headLines number of head lines covered by the hunk
 */
public record DiffRange(
	int baseStart,
	int baseLines,
	int headStart,
	int headLines
) {

	public DiffRange {
		if (baseStart < 0) {
			throw new IllegalArgumentException("baseStart must be non-negative: " + baseStart);
		}
		if (baseLines < 0) {
			throw new IllegalArgumentException("baseLines must be non-negative: " + baseLines);
		}
		if (headStart < 0) {
			throw new IllegalArgumentException("headStart must be non-negative: " + headStart);
		}
		if (headLines < 0) {
			throw new IllegalArgumentException("headLines must be non-negative: " + headLines);
		}
	}
}
