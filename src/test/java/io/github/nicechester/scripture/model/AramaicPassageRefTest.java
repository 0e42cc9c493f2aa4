package io.github.nicechester.scripture.model;

import io.github.nicechester.scripture.model.AramaicPassageRef.ChapterRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AramaicPassageRefTest {

    @Test
    @DisplayName("multi-chapter range: partial first and last chapters, whole middle chapters")
    void testRange() {
        ChapterRange range = new ChapterRange(2, 4, 7, 28);

        assertFalse(range.contains(2, 3));
        assertTrue(range.contains(2, 4));
        assertTrue(range.contains(2, 49));
        assertTrue(range.contains(4, 1));
        assertTrue(range.contains(7, 28));
        assertFalse(range.contains(7, 29));
        assertFalse(range.contains(1, 30));
        assertFalse(range.contains(8, 1));
    }

    @Test
    @DisplayName("ranges never reference chapter or verse 0")
    void testInvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> new ChapterRange(0, 1, 2, 1));
        assertThrows(IllegalArgumentException.class, () -> new ChapterRange(2, 0, 3, 1));
        assertThrows(IllegalArgumentException.class, () -> new ChapterRange(3, 1, 2, 1));
    }

    @Test
    @DisplayName("verse spans produce chapter-verse keys")
    void testVerseSpan() {
        Set<String> span = AramaicPassageRef.verseSpan(4, 8, 10);

        assertEquals(Set.of("4-8", "4-9", "4-10"), span);
        assertEquals("10-11", AramaicPassageRef.key(10, 11));
    }

    @Test
    @DisplayName("contains checks explicit verses and ranges")
    void testContains() {
        AramaicPassageRef verses = AramaicPassageRef.ofVerses(Set.of("31-47"));
        assertTrue(verses.contains(31, 47));
        assertFalse(verses.contains(31, 46));

        AramaicPassageRef ranges = AramaicPassageRef.ofRanges(new ChapterRange(2, 4, 7, 28));
        assertTrue(ranges.contains(5, 1));
        assertTrue(ranges.verses().isEmpty());
    }
}
