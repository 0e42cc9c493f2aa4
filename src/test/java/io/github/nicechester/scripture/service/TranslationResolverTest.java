package io.github.nicechester.scripture.service;

import io.github.nicechester.scripture.model.ChapterAlignment;
import io.github.nicechester.scripture.model.TranslationInfo;
import io.github.nicechester.scripture.model.TranslationLoadStatus;
import io.github.nicechester.scripture.model.TranslationTable;
import io.github.nicechester.scripture.model.VerseLookup;
import io.github.nicechester.scripture.model.VerseLookup.Status;
import io.github.nicechester.scripture.store.TranslationLoadException;
import io.github.nicechester.scripture.store.TranslationTableLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TranslationResolverTest {

    private static final Executor DIRECT = Runnable::run;

    private final Map<String, TranslationTable> tables = new HashMap<>();
    private final AtomicInteger loaderCalls = new AtomicInteger();
    private final List<ExecutorService> pools = new ArrayList<>();

    TranslationResolverTest() {
        tables.put("kjv", TranslationTable.builder("kjv")
            .verse("genesis", 1, 1, "In the beginning God created the heaven and the earth.")
            .verse("psalms", 23, 1, "The LORD is my shepherd; I shall not want.")
            .verse("psalms", 23, 2, "He maketh me to lie down in green pastures.")
            .verse("psalms", 23, 3, "He restoreth my soul.")
            .build());
        tables.put("jps", TranslationTable.builder("jps")
            .verse("psalms", 23, 1, "A Psalm of David.")
            .verse("psalms", 23, 2, "The LORD is my shepherd; I shall not want.")
            .verse("psalms", 23, 3, "He maketh me to lie down in green pastures.")
            .verse("psalms", 23, 4, "He restoreth my soul.")
            .build());
        tables.put("hebrew-ot", TranslationTable.builder("hebrew-ot")
            .verse("genesis", 1, 1, "בְּרֵאשִׁית בָּרָא אֱלֹהִים")
            .verse("psalms", 23, 1, "מִזְמוֹר לְדָוִד")
            .verse("psalms", 23, 2, "יְהוָה רֹעִי לֹא אֶחְסָר")
            .verse("psalms", 23, 3, "בִּנְאוֹת דֶּשֶׁא יַרְבִּיצֵנִי")
            .verse("psalms", 23, 4, "נַפְשִׁי יְשׁוֹבֵב")
            .build());
    }

    @AfterEach
    void shutdownPools() {
        pools.forEach(ExecutorService::shutdownNow);
    }

    @Test
    @DisplayName("first request starts the load and answers LOADING")
    void testFirstRequestLoading() {
        Queue<Runnable> tasks = new ArrayDeque<>();
        TranslationResolver resolver = resolver(this::fromTables, tasks::add, Duration.ofSeconds(5));

        VerseLookup first = resolver.resolveVerse("kjv", "Genesis", 1, 1);
        assertEquals(Status.LOADING, first.status());
        assertTrue(first.isPending());
        assertEquals(TranslationLoadStatus.State.LOADING, resolver.status("kjv").state());

        VerseLookup second = resolver.resolveVerse("KJV", "Genesis", 1, 1);
        assertEquals(Status.LOADING, second.status());
        assertEquals(1, tasks.size());

        tasks.poll().run();
        VerseLookup found = resolver.resolveVerse("kjv", "Genesis", 1, 1);
        assertEquals(Status.FOUND, found.status());
        assertEquals("In the beginning God created the heaven and the earth.", found.text());
        assertEquals("genesis", found.bookId());
        assertEquals(1, loaderCalls.get());
    }

    @Test
    @DisplayName("status does not start a load")
    void testStatusIsPassive() {
        TranslationResolver resolver = resolver(this::fromTables, DIRECT, Duration.ofSeconds(5));

        assertEquals(TranslationLoadStatus.State.NOT_LOADED, resolver.status("kjv").state());
        assertEquals(0, loaderCalls.get());
        assertTrue(resolver.loadedTranslations().isEmpty());
    }

    @Test
    @DisplayName("concurrent requests share one load")
    void testSingleFlight() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        TranslationTableLoader blocking = info -> {
            loaderCalls.incrementAndGet();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TranslationLoadException("interrupted", e);
            }
            return tables.get(info.id());
        };
        TranslationResolver resolver = resolver(blocking, pool(2), Duration.ofSeconds(5));

        ExecutorService callers = pool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CompletableFuture<TranslationTable>>> requests = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            requests.add(callers.submit(() -> {
                start.await();
                return resolver.load("kjv");
            }));
        }
        start.countDown();

        List<CompletableFuture<TranslationTable>> loads = new ArrayList<>();
        for (Future<CompletableFuture<TranslationTable>> request : requests) {
            loads.add(request.get(5, TimeUnit.SECONDS));
        }
        release.countDown();

        TranslationTable first = loads.get(0).get(5, TimeUnit.SECONDS);
        for (CompletableFuture<TranslationTable> load : loads) {
            assertSame(first, load.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, loaderCalls.get());
        assertEquals(List.of("kjv"), resolver.loadedTranslations());
    }

    @Test
    @DisplayName("loaded tables are cached")
    void testCached() throws Exception {
        TranslationResolver resolver = resolver(this::fromTables, DIRECT, Duration.ofSeconds(5));

        TranslationTable table = resolver.load("kjv").get(5, TimeUnit.SECONDS);
        assertSame(table, resolver.load("kjv").get(5, TimeUnit.SECONDS));
        assertEquals(Status.FOUND, resolver.resolveVerse("kjv", "Psalms", 23, 2).status());
        assertEquals(1, loaderCalls.get());
    }

    @Test
    @DisplayName("failed load reports LOAD_FAILED until a retry succeeds")
    void testFailureAndRetry() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        TranslationTableLoader flaky = info -> {
            if (attempts.incrementAndGet() == 1) {
                throw new TranslationLoadException("disk on fire");
            }
            return fromTables(info);
        };
        TranslationResolver resolver = resolver(flaky, DIRECT, Duration.ofSeconds(5));

        assertEquals(Status.LOADING, resolver.resolveVerse("kjv", "Genesis", 1, 1).status());
        assertEquals(Status.LOAD_FAILED, resolver.resolveVerse("kjv", "Genesis", 1, 1).status());

        TranslationLoadStatus status = resolver.status("kjv");
        assertTrue(status.isFailed());
        assertEquals("disk on fire", status.error());

        ExecutionException failure = assertThrows(ExecutionException.class,
            () -> resolver.load("kjv").get(5, TimeUnit.SECONDS));
        assertInstanceOf(TranslationLoadException.class, failure.getCause());
        assertEquals(1, attempts.get());

        resolver.retry("kjv").get(5, TimeUnit.SECONDS);
        assertEquals(Status.FOUND, resolver.resolveVerse("kjv", "Genesis", 1, 1).status());

        resolver.retry("kjv").get(5, TimeUnit.SECONDS);
        assertEquals(2, attempts.get());
    }

    @Test
    @DisplayName("a load that never finishes times out")
    void testTimeout() {
        Queue<Runnable> tasks = new ArrayDeque<>();
        TranslationResolver resolver = resolver(this::fromTables, tasks::add, Duration.ofMillis(50));

        ExecutionException failure = assertThrows(ExecutionException.class,
            () -> resolver.load("kjv").get(5, TimeUnit.SECONDS));
        assertInstanceOf(TimeoutException.class, failure.getCause());

        TranslationLoadStatus status = resolver.status("kjv");
        assertTrue(status.isFailed());
        assertEquals("load timed out", status.error());
        assertEquals(Status.LOAD_FAILED, resolver.resolveVerse("kjv", "Genesis", 1, 1).status());
    }

    @Test
    @DisplayName("cancelling a caller's future does not cancel the shared load")
    void testCancelCallerCopy() {
        Queue<Runnable> tasks = new ArrayDeque<>();
        TranslationResolver resolver = resolver(this::fromTables, tasks::add, Duration.ofSeconds(5));

        CompletableFuture<TranslationTable> mine = resolver.load("kjv");
        assertTrue(mine.cancel(true));

        tasks.poll().run();
        assertTrue(resolver.status("kjv").isLoaded());
        assertEquals(Status.FOUND, resolver.resolveVerse("kjv", "Genesis", 1, 1).status());
    }

    @Test
    @DisplayName("unknown translations are reported, never loaded")
    void testUnknownTranslation() {
        TranslationResolver resolver = resolver(this::fromTables, DIRECT, Duration.ofSeconds(5));

        assertEquals(Status.UNKNOWN_TRANSLATION, resolver.resolveVerse("klingon", "Genesis", 1, 1).status());
        assertEquals(Status.UNKNOWN_TRANSLATION, resolver.resolveVerse("klingon", "Genesis", 1, 1, 0).status());
        assertTrue(resolver.ensureLoading("klingon").isFailed());
        assertTrue(resolver.load("klingon").isCompletedExceptionally());
        assertTrue(resolver.retry("klingon").isCompletedExceptionally());
        assertEquals(0, loaderCalls.get());
    }

    @Test
    @DisplayName("loaded translation without the verse answers VERSE_NOT_FOUND")
    void testVerseNotFound() throws Exception {
        TranslationResolver resolver = resolver(this::fromTables, DIRECT, Duration.ofSeconds(5));
        resolver.load("kjv").get(5, TimeUnit.SECONDS);

        VerseLookup lookup = resolver.resolveVerse("kjv", "Genesis", 1, 99);
        assertEquals(Status.VERSE_NOT_FOUND, lookup.status());
        assertTrue(lookup.textIfFound().isEmpty());
        assertEquals(Status.VERSE_NOT_FOUND, resolver.resolveVerse("kjv", "Exodus", 1, 1).status());
    }

    @Test
    @DisplayName("source-numbering translation reads Psalm verse N from stored verse N+offset")
    void testSourceNumberingPsalm() throws Exception {
        TranslationResolver resolver = resolver(this::fromTables, DIRECT, Duration.ofSeconds(5));
        for (String id : List.of("kjv", "jps", "hebrew-ot")) {
            resolver.load(id).get(5, TimeUnit.SECONDS);
        }

        ChapterAlignment alignment = resolver.chapterAlignment("Psalms", 23).orElseThrow();
        assertEquals(1, alignment.offset());

        VerseLookup jps = resolver.resolveVerse("jps", "Psalms", 23, 1);
        VerseLookup kjv = resolver.resolveVerse("kjv", "Psalms", 23, 1);
        assertEquals("The LORD is my shepherd; I shall not want.", jps.text());
        assertEquals("The LORD is my shepherd; I shall not want.", kjv.text());
        assertEquals(1, jps.verse());

        assertEquals("He restoreth my soul.", resolver.resolveVerse("jps", "Psalms", 23, 3, 1).text());
        assertEquals("He restoreth my soul.", resolver.resolveVerse("kjv", "Psalms", 23, 3, 1).text());
        assertEquals(Status.VERSE_NOT_FOUND, resolver.resolveVerse("jps", "Psalms", 23, 4).status());
    }

    @Test
    @DisplayName("a missing Hebrew verse does not shift the Psalm offset")
    void testSourceChapterWithGap() throws Exception {
        TranslationTable.Builder hebrew = TranslationTable.builder("hebrew-ot");
        TranslationTable.Builder kjv = TranslationTable.builder("kjv");
        TranslationTable.Builder jps = TranslationTable.builder("jps");
        for (int verse = 1; verse <= 9; verse++) {
            if (verse != 5) {
                hebrew.verse("psalms", 3, verse, "hebrew" + verse);
            }
            jps.verse("psalms", 3, verse, "jps" + verse);
            if (verse <= 8) {
                kjv.verse("psalms", 3, verse, "kjv" + verse);
            }
        }
        tables.put("hebrew-ot", hebrew.build());
        tables.put("kjv", kjv.build());
        tables.put("jps", jps.build());
        TranslationResolver resolver = resolver(this::fromTables, DIRECT, Duration.ofSeconds(5));
        for (String id : List.of("kjv", "jps", "hebrew-ot")) {
            resolver.load(id).get(5, TimeUnit.SECONDS);
        }

        assertEquals(1, resolver.chapterAlignment("Psalms", 3).orElseThrow().offset());
        assertEquals("jps2", resolver.resolveVerse("jps", "Psalms", 3, 1).text());
        assertEquals("kjv1", resolver.resolveVerse("kjv", "Psalms", 3, 1).text());
    }

    @Test
    @DisplayName("Psalm lookups wait for the versification tables")
    void testPsalmWaitsForAlignment() {
        Queue<Runnable> tasks = new ArrayDeque<>();
        TranslationResolver resolver = resolver(this::fromTables, tasks::add, Duration.ofSeconds(5));

        assertEquals(Status.LOADING, resolver.resolveVerse("jps", "Psalms", 23, 1).status());
        assertTrue(resolver.chapterAlignment("Psalms", 23).isEmpty());
        assertEquals(3, tasks.size());

        while (!tasks.isEmpty()) {
            tasks.poll().run();
        }
        assertEquals("The LORD is my shepherd; I shall not want.",
            resolver.resolveVerse("jps", "Psalms", 23, 1).text());
    }

    @Test
    @DisplayName("non-Psalm chapters and failed versification tables use identity alignment")
    void testIdentityAlignment() throws Exception {
        TranslationTableLoader noHebrew = info -> {
            if (info.id().equals("hebrew-ot")) {
                throw new TranslationLoadException("missing");
            }
            return fromTables(info);
        };
        TranslationResolver resolver = resolver(noHebrew, DIRECT, Duration.ofSeconds(5));

        assertEquals(0, resolver.chapterAlignment("Genesis", 1).orElseThrow().offset());
        assertEquals(0, loaderCalls.get());

        assertTrue(resolver.chapterAlignment("Psalms", 23).isEmpty());
        ChapterAlignment fallback = resolver.chapterAlignment("Psalms", 23).orElseThrow();
        assertEquals(0, fallback.offset());

        resolver.load("jps").get(5, TimeUnit.SECONDS);
        assertEquals("A Psalm of David.", resolver.resolveVerse("jps", "Psalms", 23, 1).text());
    }

    @Test
    @DisplayName("stats report state and table sizes per translation")
    void testStats() throws Exception {
        TranslationTableLoader partial = info -> {
            if (info.id().equals("esv")) {
                throw new TranslationLoadException("Translation file not found: esv-bible.json");
            }
            return fromTables(info);
        };
        TranslationResolver resolver = resolver(partial, DIRECT, Duration.ofSeconds(5));
        resolver.load("kjv").get(5, TimeUnit.SECONDS);
        resolver.ensureLoading("esv");

        Map<String, Object> stats = resolver.getStats();
        assertEquals(List.of("esv", "kjv"), List.copyOf(stats.keySet()));
        assertEquals(Map.of("state", "LOADED", "books", 2, "verses", 4), stats.get("kjv"));
        assertEquals(Map.of("state", "FAILED", "error", "Translation file not found: esv-bible.json"), stats.get("esv"));
        assertEquals("hebrew-ot", resolver.sourceTranslationId());
        assertEquals("kjv", resolver.referenceTranslationId());
    }

    private TranslationTable fromTables(TranslationInfo info) throws TranslationLoadException {
        loaderCalls.incrementAndGet();
        TranslationTable table = tables.get(info.id());
        if (table == null) {
            throw new TranslationLoadException("Translation file not found: " + info.file());
        }
        return table;
    }

    private TranslationResolver resolver(TranslationTableLoader loader, Executor executor, Duration timeout) {
        BookCatalog books = new BookCatalog();
        return new TranslationResolver(
            new TranslationCatalog(List.of("jps")),
            books,
            new VersificationAligner(books),
            loader,
            executor,
            timeout,
            "hebrew-ot",
            "kjv");
    }

    private ExecutorService pool(int threads) {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        pools.add(pool);
        return pool;
    }
}
