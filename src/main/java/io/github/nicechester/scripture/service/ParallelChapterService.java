package io.github.nicechester.scripture.service;

import io.github.nicechester.scripture.model.BibleBook;
import io.github.nicechester.scripture.model.ChapterAlignment;
import io.github.nicechester.scripture.model.ChapterVerse;
import io.github.nicechester.scripture.model.ChapterView;
import io.github.nicechester.scripture.model.DetectedLanguage;
import io.github.nicechester.scripture.model.TranslationLoadStatus;
import io.github.nicechester.scripture.model.TranslationTable;
import io.github.nicechester.scripture.model.VerseLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds side-by-side chapter views: original-language text next to a
 * translation, numbered by the reference translation.
 *
 * <p>Old Testament originals are read through the chapter alignment, so a
 * Psalm whose Hebrew text counts the superscription as verse 1 still lines up
 * with English verse 1; the superscription itself rides on logical verse 1.
 */
@Slf4j
@Service
public class ParallelChapterService {

    private final BookCatalog bookCatalog;
    private final TranslationResolver translationResolver;
    private final LanguageClassifier languageClassifier;
    private final String greekTranslationId;

    public ParallelChapterService(
            BookCatalog bookCatalog,
            TranslationResolver translationResolver,
            LanguageClassifier languageClassifier,
            @Value("${scripture.original.greek-translation:greek-nt}") String greekTranslationId) {
        this.bookCatalog = bookCatalog;
        this.translationResolver = translationResolver;
        this.languageClassifier = languageClassifier;
        this.greekTranslationId = greekTranslationId;
    }

    /**
     * Chapter view for a translation. Reports {@code LOADING} (and starts the
     * loads) until the reference, original-language and requested tables are
     * all settled. Only a failed reference table makes the view fail; a
     * missing original or translation degrades to empty text or the
     * reference translation.
     */
    public ChapterView chapter(String book, int chapter, String translationId) {
        Optional<BibleBook> found = bookCatalog.findByName(book);
        if (found.isEmpty() || chapter < 1) {
            log.debug("Chapter not found: {} {}", book, chapter);
            return ChapterView.pending(bookCatalog.canonicalId(book), chapter, translationId, ChapterView.State.NOT_FOUND);
        }
        BibleBook bibleBook = found.get();
        String bookId = bibleBook.id();
        String originalId = bibleBook.isOldTestament()
            ? translationResolver.sourceTranslationId()
            : greekTranslationId;

        TranslationLoadStatus reference = translationResolver.ensureLoading(translationResolver.referenceTranslationId());
        TranslationLoadStatus original = translationResolver.ensureLoading(originalId);
        TranslationLoadStatus requested = translationResolver.ensureLoading(translationId);
        if (isPending(reference) || isPending(original) || isPending(requested)) {
            return ChapterView.pending(bookId, chapter, translationId, ChapterView.State.LOADING);
        }
        if (!reference.isLoaded()) {
            return ChapterView.pending(bookId, chapter, translationId, ChapterView.State.LOAD_FAILED);
        }

        ChapterAlignment alignment = bibleBook.isOldTestament()
            ? translationResolver.chapterAlignment(bookId, chapter).orElse(null)
            : ChapterAlignment.identity(bookId, chapter);
        if (alignment == null) {
            return ChapterView.pending(bookId, chapter, translationId, ChapterView.State.LOADING);
        }

        TranslationTable referenceTable = reference.table();
        TranslationTable originalTable = original.isLoaded() ? original.table() : null;
        int verseCount = referenceTable.verseCount(bookId, chapter);
        if (verseCount == 0) {
            return ChapterView.pending(bookId, chapter, translationId, ChapterView.State.NOT_FOUND);
        }

        String superscription = alignment.hasSuperscription() && originalTable != null
            ? superscription(originalTable, bookId, chapter, alignment.offset())
            : null;

        List<ChapterVerse> verses = new ArrayList<>(verseCount);
        for (int verse = 1; verse <= verseCount; verse++) {
            int sourceVerse = alignment.sourceVerse(verse);
            String originalText = originalTable != null
                ? originalTable.verse(bookId, chapter, sourceVerse).orElse("")
                : "";

            VerseLookup lookup = translationResolver.resolveVerse(translationId, bookId, chapter, verse, alignment.offset());
            String translationText = lookup.isFound()
                ? lookup.text()
                : referenceTable.verse(bookId, chapter, verse).orElse("");

            verses.add(ChapterVerse.builder()
                .verse(verse)
                .sourceVerse(sourceVerse)
                .originalText(originalText)
                .translationText(translationText)
                .fallback(!lookup.isFound())
                .language(detect(originalText, bookId, chapter, sourceVerse))
                .superscription(verse == 1 ? superscription : null)
                .build());
        }

        log.debug("Built {} {} for {}: {} verses, offset {}", bookId, chapter, translationId, verses.size(), alignment.offset());
        return new ChapterView(bookId, chapter, translationId, ChapterView.State.READY, alignment.offset(), verses);
    }

    /**
     * A single verse: original text and reference-translation text.
     * Empty until the chapter can be built.
     */
    public Optional<ChapterVerse> verse(String book, int chapter, int verse) {
        ChapterView view = chapter(book, chapter, translationResolver.referenceTranslationId());
        if (!view.isReady()) {
            return Optional.empty();
        }
        return view.verses().stream()
            .filter(v -> v.getVerse() == verse)
            .findFirst();
    }

    private DetectedLanguage detect(String originalText, String bookId, int chapter, int sourceVerse) {
        if (originalText.isEmpty()) {
            return DetectedLanguage.UNKNOWN;
        }
        return languageClassifier.classify(originalText, bookId, chapter, sourceVerse).language();
    }

    // Source verses 1..offset make up the superscription
    private static String superscription(TranslationTable originalTable, String bookId, int chapter, int offset) {
        List<String> parts = new ArrayList<>();
        for (int verse = 1; verse <= offset; verse++) {
            originalTable.verse(bookId, chapter, verse).ifPresent(parts::add);
        }
        return parts.isEmpty() ? null : String.join(" ", parts);
    }

    private static boolean isPending(TranslationLoadStatus status) {
        return status.state() == TranslationLoadStatus.State.LOADING
            || status.state() == TranslationLoadStatus.State.NOT_LOADED;
    }
}
