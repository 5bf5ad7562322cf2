package com.gt.tutor.vocab.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.tutor.model.VocabEntry;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VocabularyProviderJsonTests {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    public void testNewWordsByLevelAndFrequency() {
        VocabularyProviderJson vocabularyProvider =
                new VocabularyProviderJson(objectMapper, new ClassPathResource("vocab/dict_vocab.json"));

        assertEquals(List.of("사람", "가다", "학교", "날씨"), words(vocabularyProvider.getNewWords("beginner", Set.of(), 10)));
        assertEquals(List.of("사람", "가다", "학교", "준비", "경험", "날씨"),
                words(vocabularyProvider.getNewWords("intermediate", Set.of(), 10)));
        assertEquals(List.of("가다", "학교"), words(vocabularyProvider.getNewWords("beginner", Set.of("사람"), 2)));
    }

    @Test
    public void testUnknownLevelFallsBackToBeginner() {
        VocabularyProviderJson vocabularyProvider =
                new VocabularyProviderJson(objectMapper, new ClassPathResource("vocab/dict_vocab.json"));

        assertEquals(words(vocabularyProvider.getNewWords("beginner", Set.of(), 10)),
                words(vocabularyProvider.getNewWords("expert", Set.of(), 10)));
    }

    @Test
    public void testLegacyArrayFormat() {
        VocabularyProviderJson vocabularyProvider =
                new VocabularyProviderJson(objectMapper, new ClassPathResource("vocab/legacy_vocab.json"));

        assertEquals(List.of("물", "친구"), words(vocabularyProvider.getNewWords("beginner", Set.of(), 10)));
        assertEquals("economy", vocabularyProvider.getEntry("경제").get().translation());
        assertTrue(vocabularyProvider.getEntry("missing word").isEmpty());
    }

    @Test
    public void testEntryFields() {
        VocabularyProviderJson vocabularyProvider =
                new VocabularyProviderJson(objectMapper, new ClassPathResource("vocab/dict_vocab.json"));

        VocabEntry entry = vocabularyProvider.getEntry("날씨").get();
        assertEquals("weather", entry.translation());
        assertNull(entry.frequencyRank());
        assertEquals("Beginner", entry.tags());
    }

    @Test
    public void testMissingFileIsEmpty() {
        VocabularyProviderJson vocabularyProvider =
                new VocabularyProviderJson(objectMapper, new ClassPathResource("vocab/does_not_exist.json"));

        assertTrue(vocabularyProvider.getNewWords("beginner", Set.of(), 10).isEmpty());
    }

    private List<String> words(List<VocabEntry> entries) {
        return entries.stream().map(VocabEntry::word).toList();
    }
}
