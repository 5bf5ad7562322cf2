package com.gt.tutor.curriculum;

import com.gt.tutor.model.CurriculumPoint;
import com.gt.tutor.util.IdentifierNormalizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
public class CurriculumService {

    private final CurriculumProvider curriculumProvider;

    @Autowired
    public CurriculumService(CurriculumProvider curriculumProvider) {
        this.curriculumProvider = curriculumProvider;
    }

    // Next grammar points of a level in learning order, skipping any whose canonical id has been seen
    public List<CurriculumPoint> getUnseenGrammarPoints(String language, String level, Collection<String> seenIds, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        Set<String> canonicalSeenIds = new HashSet<>();
        for (String seenId : seenIds) {
            canonicalSeenIds.add(IdentifierNormalizer.normalize(seenId));
        }

        return curriculumProvider.getGrammarPoints(language, level).stream()
                .filter(grammarPoint -> !canonicalSeenIds.contains(grammarPoint.id()))
                .limit(limit)
                .toList();
    }
}
