package com.gt.tutor.curriculum;

import com.gt.tutor.model.CurriculumPoint;

import java.util.List;

public interface CurriculumProvider {

    // Grammar points of a level in learning order, ids already canonical
    List<CurriculumPoint> getGrammarPoints(String language, String level);
}
