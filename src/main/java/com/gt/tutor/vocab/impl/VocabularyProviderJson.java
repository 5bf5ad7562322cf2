package com.gt.tutor.vocab.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.tutor.exception.MappingException;
import com.gt.tutor.model.VocabEntry;
import com.gt.tutor.util.IdentifierNormalizer;
import com.gt.tutor.vocab.VocabularyProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Vocabulary corpus read once from a JSON document. Two layouts are accepted: an object keyed by word, and the
 * legacy array of objects that carry the word in a {@code vocab} property.
 */
public class VocabularyProviderJson implements VocabularyProvider {

    private static final Logger log = LoggerFactory.getLogger(VocabularyProviderJson.class);

    private static final String DEFAULT_LEVEL = "beginner";

    private static final Map<String, VocabLevelFilter> LEVEL_FILTERS = Map.of(
            "beginner", new VocabLevelFilter(List.of("1"), List.of("Beginner")),
            "intermediate", new VocabLevelFilter(List.of("1", "2"), List.of("Beginner", "Intermediate")),
            "advanced", new VocabLevelFilter(List.of("1", "2", "3"), List.of("Beginner", "Intermediate", "Advanced")));

    private static final Comparator<VocabEntry> FREQUENCY_ORDER = Comparator
            .comparing(VocabEntry::frequencyRank, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(VocabEntry::word);

    private final Map<String, VocabEntry> entriesByWord;

    public VocabularyProviderJson(ObjectMapper objectMapper, Resource vocabResource) {
        this.entriesByWord = readVocabulary(objectMapper, vocabResource);
    }

    @Override
    public Optional<VocabEntry> getEntry(String word) {
        return Optional.ofNullable(entriesByWord.get(word));
    }

    @Override
    public List<VocabEntry> getNewWords(String level, Collection<String> knownWords, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        VocabLevelFilter levelFilter = LEVEL_FILTERS.getOrDefault(
                level == null ? DEFAULT_LEVEL : level.trim().toLowerCase(Locale.ROOT),
                LEVEL_FILTERS.get(DEFAULT_LEVEL));

        Set<String> canonicalKnownWords = new HashSet<>();
        for (String knownWord : knownWords) {
            canonicalKnownWords.add(IdentifierNormalizer.normalize(knownWord));
        }

        return entriesByWord.values().stream()
                .filter(entry -> !canonicalKnownWords.contains(IdentifierNormalizer.normalize(entry.word())))
                .filter(levelFilter::matches)
                .sorted(FREQUENCY_ORDER)
                .limit(limit)
                .toList();
    }

    private static Map<String, VocabEntry> readVocabulary(ObjectMapper objectMapper, Resource vocabResource) {
        Map<String, VocabEntry> entries = new LinkedHashMap<>();

        if (vocabResource == null || !vocabResource.exists()) {
            log.warn("Vocabulary file not found: {}", vocabResource);
            return entries;
        }

        JsonNode root;
        try (InputStream inputStream = vocabResource.getInputStream()) {
            root = objectMapper.readTree(inputStream);
        } catch (IOException ex) {
            String errMsg = "Unable to read vocabulary " + vocabResource;
            log.error(errMsg, ex);
            throw new MappingException(errMsg, ex);
        }

        if (root == null || root.isMissingNode()) {
            log.warn("Vocabulary file is empty: {}", vocabResource);
        } else if (root.isArray()) {
            for (JsonNode entryNode : root) {
                String word = entryNode.path("vocab").asText("");
                if (word.isBlank()) {
                    log.warn("Skipping vocabulary entry without a word: {}", entryNode);
                } else {
                    entries.put(word, convertEntry(word, entryNode));
                }
            }
            log.info("Loaded {} vocabulary entries from legacy array format", entries.size());
        } else if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), convertEntry(field.getKey(), field.getValue()));
            }
            log.info("Loaded {} vocabulary entries", entries.size());
        } else {
            throw new MappingException("Invalid vocabulary format in " + vocabResource + ": " + root.getNodeType());
        }

        return entries;
    }

    private static VocabEntry convertEntry(String word, JsonNode entryNode) {
        JsonNode frequencyRankNode = entryNode.path("frequency_rank");
        Integer frequencyRank = frequencyRankNode.canConvertToInt() ? frequencyRankNode.asInt() : null;

        return new VocabEntry(
                word,
                entryNode.path("translation").asText(""),
                frequencyRank,
                entryNode.path("topik_level").asText("").trim(),
                entryNode.path("tags").asText("").trim());
    }

    private record VocabLevelFilter(List<String> topikLevels, List<String> tags) {

        boolean matches(VocabEntry entry) {
            for (String topikLevel : topikLevels) {
                if (entry.topikLevel() != null && entry.topikLevel().startsWith(topikLevel)) {
                    return true;
                }
            }
            return entry.tags() != null && tags.contains(entry.tags());
        }
    }
}
