package io.github.nicechester.scripture.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nicechester.scripture.model.TranslationInfo;
import io.github.nicechester.scripture.model.TranslationTable;
import io.github.nicechester.scripture.service.BookCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads translation documents from JSON files under the configured base path.
 *
 * <p>Two document shapes are accepted:
 * <ul>
 *   <li>nested: {@code {"translation": "KJV", "books": [{"name": "Genesis",
 *       "chapters": [{"chapter": 1, "verses": [{"verse": 1, "text": "..."}]}]}]}}</li>
 *   <li>flat: {@code {"genesis-1-1": "...", "1-samuel-3-4": "..."}}</li>
 * </ul>
 * Book names are mapped to catalog ids. Verses with blank text are skipped.
 */
@Slf4j
@Component
public class JsonTranslationTableLoader implements TranslationTableLoader {

    // book id, chapter, verse: the last two hyphen segments are numbers
    private static final Pattern FLAT_KEY = Pattern.compile("^(.+)-(\\d+)-(\\d+)$");

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final BookCatalog bookCatalog;
    private final String basePath;

    public JsonTranslationTableLoader(
            ResourceLoader resourceLoader,
            ObjectMapper objectMapper,
            BookCatalog bookCatalog,
            @Value("${scripture.data.base-path:classpath:texts/}") String basePath) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.bookCatalog = bookCatalog;
        this.basePath = basePath.endsWith("/") ? basePath : basePath + "/";
    }

    @Override
    public TranslationTable load(TranslationInfo translation) throws TranslationLoadException {
        String location = basePath + translation.file();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new TranslationLoadException("Translation file not found: " + location);
        }

        JsonNode root;
        try (InputStream inputStream = resource.getInputStream()) {
            root = objectMapper.readTree(inputStream);
        } catch (JsonProcessingException e) {
            throw new TranslationLoadException("Malformed JSON in " + location + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new TranslationLoadException("Failed to read " + location, e);
        }

        if (root == null || !root.isObject()) {
            throw new TranslationLoadException("Expected a JSON object in " + location);
        }

        TranslationTable table = root.has("books")
            ? parseNested(translation.id(), root.get("books"), location)
            : parseFlat(translation.id(), root, location);

        log.debug("Parsed {} from {}", table, location);
        return table;
    }

    private TranslationTable parseNested(String translationId, JsonNode booksNode, String location)
            throws TranslationLoadException {
        if (!booksNode.isArray()) {
            throw new TranslationLoadException("'books' is not an array in " + location);
        }

        TranslationTable.Builder builder = TranslationTable.builder(translationId);
        for (JsonNode bookNode : booksNode) {
            String bookName = text(bookNode, "name", text(bookNode, "bookName", text(bookNode, "id", null)));
            if (bookName == null) {
                log.warn("Skipping book without a name in {}", location);
                continue;
            }
            String bookId = bookCatalog.canonicalId(bookName);

            JsonNode chaptersNode = bookNode.get("chapters");
            if (chaptersNode == null || !chaptersNode.isArray()) continue;

            for (JsonNode chapterNode : chaptersNode) {
                int chapterNum = chapterNode.path("chapter").asInt(0);
                JsonNode versesNode = chapterNode.get("verses");
                if (chapterNum < 1 || versesNode == null || !versesNode.isArray()) continue;

                for (JsonNode verseNode : versesNode) {
                    int verseNum = verseNode.path("verse").asInt(0);
                    String text = text(verseNode, "text", "");
                    if (verseNum >= 1 && !text.isBlank()) {
                        builder.verse(bookId, chapterNum, verseNum, text);
                    }
                }
            }
        }
        return builder.build();
    }

    private TranslationTable parseFlat(String translationId, JsonNode root, String location)
            throws TranslationLoadException {
        TranslationTable.Builder builder = TranslationTable.builder(translationId);
        int accepted = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Matcher matcher = FLAT_KEY.matcher(field.getKey());
            if (!matcher.matches() || !field.getValue().isTextual()) {
                continue;
            }
            String text = field.getValue().asText();
            if (text.isBlank()) {
                continue;
            }
            int chapter;
            int verse;
            try {
                chapter = Integer.parseInt(matcher.group(2));
                verse = Integer.parseInt(matcher.group(3));
            } catch (NumberFormatException e) {
                log.warn("Skipping out-of-range reference '{}' in {}", field.getKey(), location);
                continue;
            }
            if (chapter < 1 || verse < 1) {
                continue;
            }
            builder.verse(bookCatalog.canonicalId(matcher.group(1)), chapter, verse, text);
            accepted++;
        }
        if (accepted == 0 && root.size() > 0) {
            throw new TranslationLoadException("Unrecognised translation document shape in " + location);
        }
        return builder.build();
    }

    private static String text(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : defaultValue;
    }
}
