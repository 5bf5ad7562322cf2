package com.gt.tutor.model;

import java.util.List;

public record SessionSelection(List<String> reviewGrammar,
                               List<String> reviewVocab,
                               List<String> newGrammar,
                               List<String> newVocab) {

    public SessionSelection {
        reviewGrammar = List.copyOf(reviewGrammar);
        reviewVocab = List.copyOf(reviewVocab);
        newGrammar = List.copyOf(newGrammar);
        newVocab = List.copyOf(newVocab);
    }

    public boolean hasNewContent() {
        return !newGrammar.isEmpty() || !newVocab.isEmpty();
    }

    public int size() {
        return reviewGrammar.size() + reviewVocab.size() + newGrammar.size() + newVocab.size();
    }
}
