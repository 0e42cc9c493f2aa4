package io.github.nicechester.scripture.service;

import io.github.nicechester.scripture.model.TranslationInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Translations and original-language corpora known to the resolver.
 * All bundled texts are public domain or openly licensed.
 */
@Slf4j
@Service
public class TranslationCatalog {

    private static final List<TranslationInfo> TRANSLATIONS = List.of(
        translation("kjv", "King James Version", "KJV", "kjv-complete.json"),
        translation("esv", "English Standard Version", "ESV", "esv-bible.json"),
        translation("asv", "American Standard Version", "ASV", "asv-bible.json"),
        translation("bsb", "Berean Standard Bible", "BSB", "bsb-bible.json"),
        translation("net", "New English Translation", "NET", "net-bible.json"),
        translation("bbe", "Bible in Basic English", "BBE", "bbe-bible.json"),
        translation("darby", "Darby Translation", "Darby", "darby-bible.json"),
        translation("drc", "Douay-Rheims Catholic", "DRC", "drc-bible.json"),
        translation("geneva", "Geneva Bible 1599", "Geneva", "geneva-1599.json"),
        translation("jps", "JPS Tanakh 1917", "JPS", "jps-bible.json"),
        translation("jubilee", "Jubilee Bible", "JUB", "jubilee-bible.json"),
        translation("leb", "Lexham English Bible", "LEB", "leb-bible.json"),
        translation("litv", "Literal Translation", "LITV", "litv-bible.json"),
        translation("mkjv", "Modern KJV", "MKJV", "mkjv-bible.json"),
        translation("nheb", "New Heart English Bible", "NHEB", "nheb-bible.json"),
        translation("webster", "Webster's Bible", "Webster", "webster-bible.json"),
        translation("ylt", "Young's Literal Translation", "YLT", "ylt-bible.json"),
        translation("akjv", "American KJV", "AKJV", "akjv-bible.json"),
        translation("kjvpce", "KJV Pure Cambridge", "KJVPCE", "kjvpce-bible.json"),
        // Original-language corpora
        translation("hebrew-ot", "Hebrew Old Testament (Masoretic)", "WLC", "hebrew-ot-complete.json"),
        translation("greek-nt", "Greek New Testament", "GNT", "greek-nt-clean.json")
    );

    private final Map<String, TranslationInfo> byId;

    public TranslationCatalog(
            @Value("${scripture.versification.source-numbering:jps}") List<String> sourceNumbering) {
        Set<String> followsSource = sourceNumbering.stream()
            .map(id -> id.trim().toLowerCase(Locale.ROOT))
            .filter(id -> !id.isEmpty())
            .collect(Collectors.toSet());

        Map<String, TranslationInfo> translations = new LinkedHashMap<>();
        for (TranslationInfo info : TRANSLATIONS) {
            translations.put(info.id(), info.withSourceNumbering(followsSource.contains(info.id())));
        }
        for (String id : followsSource) {
            if (!translations.containsKey(id)) {
                log.warn("Source-numbering translation '{}' is not in the catalog; ignoring", id);
            }
        }
        this.byId = translations;
        log.info("Translation catalog ready: {} translations, source numbering: {}", byId.size(), followsSource);
    }

    public Optional<TranslationInfo> find(String translationId) {
        if (translationId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(translationId.trim().toLowerCase(Locale.ROOT)));
    }

    public boolean followsSourceNumbering(String translationId) {
        return find(translationId).map(TranslationInfo::followsSourceNumbering).orElse(false);
    }

    public List<TranslationInfo> all() {
        return List.copyOf(byId.values());
    }

    private static TranslationInfo translation(String id, String name, String abbreviation, String file) {
        return new TranslationInfo(id, name, abbreviation, file, false);
    }
}
