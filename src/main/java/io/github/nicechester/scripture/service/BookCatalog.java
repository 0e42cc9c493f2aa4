package io.github.nicechester.scripture.service;

import io.github.nicechester.scripture.model.BibleBook;
import io.github.nicechester.scripture.model.BibleBook.Testament;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The 66 canonical books with their machine ids, display names and chapter counts.
 *
 * <p>Lookups accept a machine id ("1-samuel"), a display name ("1 Samuel") or an
 * abbreviation ("1 Sam"), ignoring case, whitespace and hyphens.
 */
@Slf4j
@Service
public class BookCatalog {

    public static final String PSALMS = "psalms";

    private static final List<BibleBook> BOOKS = List.of(
        // Old Testament - Law
        ot("genesis", "Genesis", 50, "Gen", "Law"),
        ot("exodus", "Exodus", 40, "Exod", "Law"),
        ot("leviticus", "Leviticus", 27, "Lev", "Law"),
        ot("numbers", "Numbers", 36, "Num", "Law"),
        ot("deuteronomy", "Deuteronomy", 34, "Deut", "Law"),
        // Old Testament - History
        ot("joshua", "Joshua", 24, "Josh", "History"),
        ot("judges", "Judges", 21, "Judg", "History"),
        ot("ruth", "Ruth", 4, "Ruth", "History"),
        ot("1-samuel", "1 Samuel", 31, "1 Sam", "History"),
        ot("2-samuel", "2 Samuel", 24, "2 Sam", "History"),
        ot("1-kings", "1 Kings", 22, "1 Kgs", "History"),
        ot("2-kings", "2 Kings", 25, "2 Kgs", "History"),
        ot("1-chronicles", "1 Chronicles", 29, "1 Chr", "History"),
        ot("2-chronicles", "2 Chronicles", 36, "2 Chr", "History"),
        ot("ezra", "Ezra", 10, "Ezra", "History"),
        ot("nehemiah", "Nehemiah", 13, "Neh", "History"),
        ot("esther", "Esther", 10, "Esth", "History"),
        // Old Testament - Poetry/Wisdom
        ot("job", "Job", 42, "Job", "Poetry"),
        ot(PSALMS, "Psalms", 150, "Ps", "Poetry"),
        ot("proverbs", "Proverbs", 31, "Prov", "Poetry"),
        ot("ecclesiastes", "Ecclesiastes", 12, "Eccl", "Poetry"),
        ot("song-of-solomon", "Song of Solomon", 8, "Song", "Poetry"),
        // Old Testament - Major Prophets
        ot("isaiah", "Isaiah", 66, "Isa", "Major Prophets"),
        ot("jeremiah", "Jeremiah", 52, "Jer", "Major Prophets"),
        ot("lamentations", "Lamentations", 5, "Lam", "Major Prophets"),
        ot("ezekiel", "Ezekiel", 48, "Ezek", "Major Prophets"),
        ot("daniel", "Daniel", 12, "Dan", "Major Prophets"),
        // Old Testament - Minor Prophets
        ot("hosea", "Hosea", 14, "Hos", "Minor Prophets"),
        ot("joel", "Joel", 3, "Joel", "Minor Prophets"),
        ot("amos", "Amos", 9, "Amos", "Minor Prophets"),
        ot("obadiah", "Obadiah", 1, "Obad", "Minor Prophets"),
        ot("jonah", "Jonah", 4, "Jonah", "Minor Prophets"),
        ot("micah", "Micah", 7, "Mic", "Minor Prophets"),
        ot("nahum", "Nahum", 3, "Nah", "Minor Prophets"),
        ot("habakkuk", "Habakkuk", 3, "Hab", "Minor Prophets"),
        ot("zephaniah", "Zephaniah", 3, "Zeph", "Minor Prophets"),
        ot("haggai", "Haggai", 2, "Hag", "Minor Prophets"),
        ot("zechariah", "Zechariah", 14, "Zech", "Minor Prophets"),
        ot("malachi", "Malachi", 4, "Mal", "Minor Prophets"),
        // New Testament - Gospels and Acts
        nt("matthew", "Matthew", 28, "Matt", "Gospel"),
        nt("mark", "Mark", 16, "Mark", "Gospel"),
        nt("luke", "Luke", 24, "Luke", "Gospel"),
        nt("john", "John", 21, "John", "Gospel"),
        nt("acts", "Acts", 28, "Acts", "History"),
        // New Testament - Epistles
        nt("romans", "Romans", 16, "Rom", "Epistle"),
        nt("1-corinthians", "1 Corinthians", 16, "1 Cor", "Epistle"),
        nt("2-corinthians", "2 Corinthians", 13, "2 Cor", "Epistle"),
        nt("galatians", "Galatians", 6, "Gal", "Epistle"),
        nt("ephesians", "Ephesians", 6, "Eph", "Epistle"),
        nt("philippians", "Philippians", 4, "Phil", "Epistle"),
        nt("colossians", "Colossians", 4, "Col", "Epistle"),
        nt("1-thessalonians", "1 Thessalonians", 5, "1 Thess", "Epistle"),
        nt("2-thessalonians", "2 Thessalonians", 3, "2 Thess", "Epistle"),
        nt("1-timothy", "1 Timothy", 6, "1 Tim", "Epistle"),
        nt("2-timothy", "2 Timothy", 4, "2 Tim", "Epistle"),
        nt("titus", "Titus", 3, "Titus", "Epistle"),
        nt("philemon", "Philemon", 1, "Phlm", "Epistle"),
        nt("hebrews", "Hebrews", 13, "Heb", "Epistle"),
        nt("james", "James", 5, "Jas", "Epistle"),
        nt("1-peter", "1 Peter", 5, "1 Pet", "Epistle"),
        nt("2-peter", "2 Peter", 3, "2 Pet", "Epistle"),
        nt("1-john", "1 John", 5, "1 John", "Epistle"),
        nt("2-john", "2 John", 1, "2 John", "Epistle"),
        nt("3-john", "3 John", 1, "3 John", "Epistle"),
        nt("jude", "Jude", 1, "Jude", "Epistle"),
        // New Testament - Prophecy
        nt("revelation", "Revelation", 22, "Rev", "Prophecy")
    );

    private final Map<String, BibleBook> byId;
    private final Map<String, BibleBook> byLookupKey;

    public BookCatalog() {
        Map<String, BibleBook> ids = new HashMap<>();
        Map<String, BibleBook> keys = new HashMap<>();
        for (BibleBook book : BOOKS) {
            ids.put(book.id(), book);
            keys.putIfAbsent(lookupKey(book.id()), book);
            keys.putIfAbsent(lookupKey(book.name()), book);
            keys.putIfAbsent(lookupKey(book.abbreviation()), book);
        }
        this.byId = Map.copyOf(ids);
        this.byLookupKey = Map.copyOf(keys);
        log.info("Book catalog ready: {} books ({} lookup keys)", BOOKS.size(), byLookupKey.size());
    }

    public List<BibleBook> all() {
        return BOOKS;
    }

    public int size() {
        return BOOKS.size();
    }

    public Optional<BibleBook> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    /**
     * Find a book by id, display name or abbreviation.
     */
    public Optional<BibleBook> findByName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byLookupKey.get(lookupKey(name)));
    }

    /**
     * Catalog id for a book reference. Books missing from the catalog map to
     * their lowercased name with whitespace runs replaced by '-'.
     */
    public String canonicalId(String name) {
        if (name == null) {
            return "";
        }
        return findByName(name)
            .map(BibleBook::id)
            .orElseGet(() -> name.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-"));
    }

    public List<BibleBook> byTestament(Testament testament) {
        return BOOKS.stream()
            .filter(b -> b.testament() == testament)
            .toList();
    }

    public boolean isPsalms(String name) {
        return PSALMS.equals(canonicalId(name));
    }

    private static String lookupKey(String value) {
        return value.toLowerCase(Locale.ROOT).replaceAll("[\\s-]", "");
    }

    private static BibleBook ot(String id, String name, int chapters, String abbreviation, String category) {
        return new BibleBook(id, name, Testament.OT, chapters, abbreviation, category);
    }

    private static BibleBook nt(String id, String name, int chapters, String abbreviation, String category) {
        return new BibleBook(id, name, Testament.NT, chapters, abbreviation, category);
    }
}
