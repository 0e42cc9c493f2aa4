package io.github.nicechester.scripture.model;

import java.util.List;

/**
 * Script blocks recognised by the classifier. The range sets are disjoint
 * from each other.
 */
public enum ScriptBlock {
    /** Hebrew block, letters plus points and cantillation (U+0590 - U+05FF) */
    HEBREW(List.of(new CodePointRange(0x0590, 0x05FF))),
    /** Greek and Coptic (U+0370 - U+03FF) plus Greek Extended (U+1F00 - U+1FFF) */
    GREEK(List.of(
        new CodePointRange(0x0370, 0x03FF),
        new CodePointRange(0x1F00, 0x1FFF)
    )),
    /** Imperial Aramaic, supplementary plane (U+10840 - U+1085F) */
    IMPERIAL_ARAMAIC(List.of(new CodePointRange(0x10840, 0x1085F)));

    private final List<CodePointRange> ranges;

    ScriptBlock(List<CodePointRange> ranges) {
        this.ranges = ranges;
    }

    public boolean contains(int codePoint) {
        for (CodePointRange range : ranges) {
            if (range.contains(codePoint)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Block owning the code point, or null when it belongs to none.
     */
    public static ScriptBlock of(int codePoint) {
        for (ScriptBlock block : values()) {
            if (block.contains(codePoint)) {
                return block;
            }
        }
        return null;
    }
}
