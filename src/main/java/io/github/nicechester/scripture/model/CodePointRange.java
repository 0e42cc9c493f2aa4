package io.github.nicechester.scripture.model;

/**
 * Inclusive range of Unicode code points belonging to one script block.
 */
public record CodePointRange(int start, int end) {

    public CodePointRange {
        if (start > end) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
    }

    public boolean contains(int codePoint) {
        return codePoint >= start && codePoint <= end;
    }
}
