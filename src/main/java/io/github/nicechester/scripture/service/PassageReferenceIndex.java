package io.github.nicechester.scripture.service;

import io.github.nicechester.scripture.model.AramaicPassageRef;
import io.github.nicechester.scripture.model.AramaicPassageRef.ChapterRange;
import io.github.nicechester.scripture.model.BibleBook;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Biblical Aramaic passages written in Hebrew square script.
 *
 * <p>Covers Daniel 2:4-7:28, Ezra 4:8-6:18 and 7:12-26, Jeremiah 10:11 and
 * Genesis 31:47. Daniel 2:4 switches language mid-verse; the whole verse is
 * treated as Aramaic.
 */
@Service
@RequiredArgsConstructor
public class PassageReferenceIndex {

    private static final Map<String, AramaicPassageRef> ARAMAIC_PASSAGES = Map.of(
        "daniel", AramaicPassageRef.ofRanges(new ChapterRange(2, 4, 7, 28)),
        "ezra", AramaicPassageRef.ofVerses(union(
            AramaicPassageRef.verseSpan(4, 8, 24),
            AramaicPassageRef.verseSpan(5, 1, 17),
            AramaicPassageRef.verseSpan(6, 1, 18),
            AramaicPassageRef.verseSpan(7, 12, 26)
        )),
        "jeremiah", AramaicPassageRef.ofVerses(Set.of(AramaicPassageRef.key(10, 11))),
        "genesis", AramaicPassageRef.ofVerses(Set.of(AramaicPassageRef.key(31, 47)))
    );

    // Numbered books are keyed number-last
    private static final Map<String, String> BOOK_ALIASES = Map.of(
        "1samuel", "samuel1", "2samuel", "samuel2",
        "1kings", "kings1", "2kings", "kings2",
        "1chronicles", "chronicles1", "2chronicles", "chronicles2"
    );

    private final BookCatalog bookCatalog;

    /**
     * Whether the verse lies in a known Aramaic passage. Unknown books and
     * non-positive chapter or verse numbers answer false.
     */
    public boolean isAramaicPassage(String book, int chapter, int verse) {
        if (book == null || book.isBlank() || chapter < 1 || verse < 1) {
            return false;
        }
        AramaicPassageRef passage = ARAMAIC_PASSAGES.get(normalizeBook(book));
        return passage != null && passage.contains(chapter, verse);
    }

    /**
     * Index key for a book reference: catalog id when known, then lowercased
     * with whitespace and hyphens removed and numbered books aliased
     * ("1 Samuel" → "samuel1").
     */
    public String normalizeBook(String book) {
        String id = bookCatalog.findByName(book)
            .map(BibleBook::id)
            .orElse(book);
        String compact = id.toLowerCase(Locale.ROOT).replaceAll("[\\s-]", "");
        return BOOK_ALIASES.getOrDefault(compact, compact);
    }

    public Set<String> booksWithAramaic() {
        return ARAMAIC_PASSAGES.keySet();
    }

    @SafeVarargs
    private static Set<String> union(Set<String>... spans) {
        Set<String> all = new HashSet<>();
        for (Set<String> span : spans) {
            all.addAll(span);
        }
        return all;
    }
}
