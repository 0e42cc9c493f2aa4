package io.github.nicechester.scripture.service;

import io.github.nicechester.scripture.config.TranslationLoaderConfig;
import io.github.nicechester.scripture.model.ChapterAlignment;
import io.github.nicechester.scripture.model.TranslationInfo;
import io.github.nicechester.scripture.model.TranslationLoadStatus;
import io.github.nicechester.scripture.model.TranslationTable;
import io.github.nicechester.scripture.model.VerseLookup;
import io.github.nicechester.scripture.model.VerseLookup.Status;
import io.github.nicechester.scripture.store.TranslationLoadException;
import io.github.nicechester.scripture.store.TranslationTableLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves verse texts from lazily loaded, cached translation tables.
 *
 * <p>Each translation is loaded at most once at a time: the first request for
 * an uncached translation starts the load and answers {@link Status#LOADING};
 * callers ask again (or wait on {@link #load}) once it completes. Concurrent
 * requests share the same in-flight load. Loaded tables stay cached for the
 * lifetime of the resolver. A failed or timed-out load answers
 * {@link Status#LOAD_FAILED} until {@link #retry} succeeds.
 *
 * <p>Translations that follow source-language numbering are read at
 * {@code logical verse + chapter offset}, the offset coming from the verse
 * counts of the source and reference tables.
 */
@Slf4j
@Service
public class TranslationResolver {

    private final TranslationCatalog translationCatalog;
    private final BookCatalog bookCatalog;
    private final VersificationAligner versificationAligner;
    private final TranslationTableLoader loader;
    private final Executor loadExecutor;
    private final Duration loadTimeout;
    private final String sourceTranslationId;
    private final String referenceTranslationId;

    // translation id -> shared load; completed futures are the cache
    private final ConcurrentMap<String, CompletableFuture<TranslationTable>> loads = new ConcurrentHashMap<>();

    public TranslationResolver(
            TranslationCatalog translationCatalog,
            BookCatalog bookCatalog,
            VersificationAligner versificationAligner,
            TranslationTableLoader loader,
            @Qualifier(TranslationLoaderConfig.LOAD_EXECUTOR) Executor loadExecutor,
            @Value("${scripture.translation.load-timeout:30s}") Duration loadTimeout,
            @Value("${scripture.versification.source-translation:hebrew-ot}") String sourceTranslationId,
            @Value("${scripture.versification.reference-translation:kjv}") String referenceTranslationId) {
        this.translationCatalog = translationCatalog;
        this.bookCatalog = bookCatalog;
        this.versificationAligner = versificationAligner;
        this.loader = loader;
        this.loadExecutor = loadExecutor;
        this.loadTimeout = loadTimeout;
        this.sourceTranslationId = sourceTranslationId;
        this.referenceTranslationId = referenceTranslationId;
        log.info("Translation resolver: source={}, reference={}, load timeout={}",
            sourceTranslationId, referenceTranslationId, loadTimeout);
    }

    /**
     * Text of a logical verse in a translation.
     *
     * <p>For source-numbering translations in Psalms the chapter offset is
     * needed; while the source or reference table is still loading the answer
     * is {@link Status#LOADING}. If either of them failed to load the offset
     * falls back to 0.
     */
    public VerseLookup resolveVerse(String translationId, String book, int chapter, int verse) {
        String bookId = bookCatalog.canonicalId(book);
        Optional<TranslationInfo> info = translationCatalog.find(translationId);
        if (info.isEmpty()) {
            log.warn("Unknown translation requested: {}", translationId);
            return VerseLookup.absent(Status.UNKNOWN_TRANSLATION, translationId, bookId, chapter, verse);
        }

        int offset = 0;
        if (info.get().followsSourceNumbering() && versificationAligner.appliesTo(bookId)) {
            Optional<ChapterAlignment> alignment = chapterAlignment(bookId, chapter);
            if (alignment.isEmpty()) {
                ensureLoading(info.get().id());
                return VerseLookup.absent(Status.LOADING, info.get().id(), bookId, chapter, verse);
            }
            offset = alignment.get().offset();
        }
        return lookup(info.get(), bookId, chapter, verse, offset);
    }

    /**
     * Text of a logical verse when the caller already knows the chapter offset.
     * The offset is only applied to source-numbering translations.
     */
    public VerseLookup resolveVerse(String translationId, String book, int chapter, int verse, int offset) {
        String bookId = bookCatalog.canonicalId(book);
        Optional<TranslationInfo> info = translationCatalog.find(translationId);
        if (info.isEmpty()) {
            log.warn("Unknown translation requested: {}", translationId);
            return VerseLookup.absent(Status.UNKNOWN_TRANSLATION, translationId, bookId, chapter, verse);
        }
        return lookup(info.get(), bookId, chapter, verse, offset);
    }

    /**
     * Alignment of a chapter between source and reference numbering.
     * Empty while either table is loading (their loads are started); the
     * identity alignment when either failed to load.
     */
    public Optional<ChapterAlignment> chapterAlignment(String book, int chapter) {
        String bookId = bookCatalog.canonicalId(book);
        if (!versificationAligner.appliesTo(bookId)) {
            return Optional.of(ChapterAlignment.identity(bookId, chapter));
        }

        TranslationLoadStatus source = ensureLoading(sourceTranslationId);
        TranslationLoadStatus reference = ensureLoading(referenceTranslationId);
        if (isPending(source) || isPending(reference)) {
            return Optional.empty();
        }
        if (!source.isLoaded() || !reference.isLoaded()) {
            log.warn("Versification tables unavailable ({}={}, {}={}); using identity alignment",
                sourceTranslationId, source.state(), referenceTranslationId, reference.state());
            return Optional.of(ChapterAlignment.identity(bookId, chapter));
        }

        return Optional.of(versificationAligner.align(bookId, chapter,
            source.table().lastVerse(bookId, chapter),
            reference.table().verseCount(bookId, chapter)));
    }

    /**
     * Current load state, without starting a load.
     */
    public TranslationLoadStatus status(String translationId) {
        String id = normalizeId(translationId);
        CompletableFuture<TranslationTable> load = loads.get(id);
        if (load == null) {
            return TranslationLoadStatus.notLoaded(id);
        }
        return statusOf(id, load);
    }

    /**
     * Current load state, starting the load when the translation has not been
     * requested before. Unknown ids report {@code FAILED}.
     */
    public TranslationLoadStatus ensureLoading(String translationId) {
        Optional<TranslationInfo> info = translationCatalog.find(translationId);
        if (info.isEmpty()) {
            return TranslationLoadStatus.failed(translationId, "Unknown translation: " + translationId);
        }
        String id = info.get().id();
        CompletableFuture<TranslationTable> existing = loads.get(id);
        if (existing == null) {
            loads.computeIfAbsent(id, k -> startLoad(info.get()));
            return TranslationLoadStatus.loading(id);
        }
        return statusOf(id, existing);
    }

    /**
     * Future completing with the table once loaded, starting the load if
     * needed. The returned future is a copy: cancelling it does not cancel the
     * shared load, which still completes and fills the cache.
     */
    public CompletableFuture<TranslationTable> load(String translationId) {
        Optional<TranslationInfo> info = translationCatalog.find(translationId);
        if (info.isEmpty()) {
            return CompletableFuture.failedFuture(
                new TranslationLoadException("Unknown translation: " + translationId));
        }
        return loads.computeIfAbsent(info.get().id(), k -> startLoad(info.get())).copy();
    }

    /**
     * Start a new load for a translation whose previous load failed.
     * Loaded or in-flight translations are left untouched.
     */
    public CompletableFuture<TranslationTable> retry(String translationId) {
        Optional<TranslationInfo> info = translationCatalog.find(translationId);
        if (info.isEmpty()) {
            return CompletableFuture.failedFuture(
                new TranslationLoadException("Unknown translation: " + translationId));
        }
        return loads.compute(info.get().id(), (id, existing) -> {
            if (existing == null || existing.isCompletedExceptionally()) {
                log.info("Retrying load of translation {}", id);
                return startLoad(info.get());
            }
            return existing;
        }).copy();
    }

    public List<String> loadedTranslations() {
        return loads.entrySet().stream()
            .filter(e -> e.getValue().isDone() && !e.getValue().isCompletedExceptionally())
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
    }

    /**
     * Per-translation load state and table sizes.
     */
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        for (String id : loads.keySet().stream().sorted().toList()) {
            TranslationLoadStatus status = status(id);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("state", status.state().name());
            if (status.isLoaded()) {
                entry.put("books", status.table().bookCount());
                entry.put("verses", status.table().verseCount());
            }
            if (status.isFailed()) {
                entry.put("error", status.error());
            }
            stats.put(id, entry);
        }
        return stats;
    }

    public String sourceTranslationId() {
        return sourceTranslationId;
    }

    public String referenceTranslationId() {
        return referenceTranslationId;
    }

    private VerseLookup lookup(TranslationInfo info, String bookId, int chapter, int verse, int offset) {
        String id = info.id();
        TranslationLoadStatus status = ensureLoading(id);
        return switch (status.state()) {
            case NOT_LOADED, LOADING -> VerseLookup.absent(Status.LOADING, id, bookId, chapter, verse);
            case FAILED -> VerseLookup.absent(Status.LOAD_FAILED, id, bookId, chapter, verse);
            case LOADED -> {
                int physical = versificationAligner.physicalVerse(verse, offset, info.followsSourceNumbering());
                yield status.table().verse(bookId, chapter, physical)
                    .map(text -> VerseLookup.found(id, bookId, chapter, verse, text))
                    .orElseGet(() -> VerseLookup.absent(Status.VERSE_NOT_FOUND, id, bookId, chapter, verse));
            }
        };
    }

    private CompletableFuture<TranslationTable> startLoad(TranslationInfo info) {
        log.info("Loading translation {} ({})", info.id(), info.file());
        long startTime = System.currentTimeMillis();

        CompletableFuture<TranslationTable> load;
        try {
            load = CompletableFuture.supplyAsync(() -> loadTable(info), loadExecutor);
        } catch (RejectedExecutionException e) {
            load = CompletableFuture.failedFuture(e);
        }

        return load
            .orTimeout(loadTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((table, error) -> {
                long duration = System.currentTimeMillis() - startTime;
                if (error != null) {
                    Throwable cause = unwrap(error);
                    log.error("Failed to load translation {} after {}ms: {}", info.id(), duration, describe(cause), cause);
                } else {
                    log.info("Loaded translation {} in {}ms: {} books, {} verses",
                        info.id(), duration, table.bookCount(), table.verseCount());
                }
            });
    }

    private TranslationTable loadTable(TranslationInfo info) {
        try {
            return loader.load(info);
        } catch (TranslationLoadException e) {
            throw new CompletionException(e);
        }
    }

    private static TranslationLoadStatus statusOf(String id, CompletableFuture<TranslationTable> load) {
        if (!load.isDone()) {
            return TranslationLoadStatus.loading(id);
        }
        try {
            return TranslationLoadStatus.loaded(load.join());
        } catch (CompletionException | CancellationException e) {
            return TranslationLoadStatus.failed(id, describe(unwrap(e)));
        }
    }

    private static boolean isPending(TranslationLoadStatus status) {
        return status.state() == TranslationLoadStatus.State.LOADING
            || status.state() == TranslationLoadStatus.State.NOT_LOADED;
    }

    private String normalizeId(String translationId) {
        Objects.requireNonNull(translationId, "translationId");
        return translationCatalog.find(translationId)
            .map(TranslationInfo::id)
            .orElse(translationId);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "load timed out";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
