package com.gt.tutor.vocab;

import com.gt.tutor.model.VocabEntry;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface VocabularyProvider {

    Optional<VocabEntry> getEntry(String word);

    // Level-appropriate words not in knownWords, most frequent first
    List<VocabEntry> getNewWords(String level, Collection<String> knownWords, int limit);
}
