package com.gt.tutor.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

public enum ExerciseCategory {
    MultipleChoice("multiple_choice", DifficultyTier.Recognition),
    ErrorCorrection("error_correction", DifficultyTier.Recognition),
    FillInBlank("fill_in_blank", DifficultyTier.GuidedProduction),
    FillMultipleBlanks("fill_multiple_blanks", DifficultyTier.StructuredProduction),
    SentenceBuilding("sentence_building", DifficultyTier.StructuredProduction),
    Translation("translation", DifficultyTier.FreeProduction);

    private static final Map<String, ExerciseCategory> categoriesById = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(category -> category.id, category -> category));

    private final String id;
    private final DifficultyTier tier;

    ExerciseCategory(String id, DifficultyTier tier) {
        this.id = id;
        this.tier = tier;
    }

    public String getId() {
        return id;
    }

    public DifficultyTier getTier() {
        return tier;
    }

    public static ExerciseCategory fromId(String id) {
        ExerciseCategory category = id == null ? null : categoriesById.get(id.trim().toLowerCase(Locale.ROOT));
        if (category == null) {
            throw new IllegalArgumentException("Unknown exercise category " + id);
        }

        return category;
    }

    public static List<ExerciseCategory> forTier(DifficultyTier tier) {
        return Arrays.stream(values()).filter(category -> category.tier == tier).toList();
    }
}
