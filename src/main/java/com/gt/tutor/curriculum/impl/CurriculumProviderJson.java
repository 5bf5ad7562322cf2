package com.gt.tutor.curriculum.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.tutor.conf.CachingConfig;
import com.gt.tutor.curriculum.CurriculumProvider;
import com.gt.tutor.exception.MappingException;
import com.gt.tutor.model.CurriculumPoint;
import com.gt.tutor.util.IdentifierNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Reads grammar curricula from JSON documents shaped as
 * {@code {"levels": {"beginner": {"grammar_points": [{"id": ..., "description": ..., "learning_order": ...}]}}}}.
 * One document per language, located by formatting the language name into {@code locationPattern}. Parsed levels
 * are cached in {@link CachingConfig#CURRICULUM}.
 */
public class CurriculumProviderJson implements CurriculumProvider {

    private static final Logger log = LoggerFactory.getLogger(CurriculumProviderJson.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final String locationPattern;

    public CurriculumProviderJson(ObjectMapper objectMapper, ResourceLoader resourceLoader, String locationPattern) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.locationPattern = locationPattern;
    }

    @Override
    @Cacheable(CachingConfig.CURRICULUM)
    public List<CurriculumPoint> getGrammarPoints(String language, String level) {
        String levelKey = level == null ? "" : level.trim().toLowerCase(Locale.ROOT);
        JsonNode levelNode = loadCurriculum(language).path("levels").path(levelKey);
        if (levelNode.isMissingNode()) {
            log.warn("Level '{}' not found in {} curriculum", levelKey, language);
            return List.of();
        }

        List<CurriculumPoint> grammarPoints = new ArrayList<>();
        int position = 0;
        for (JsonNode grammarPointNode : levelNode.path("grammar_points")) {
            String id = IdentifierNormalizer.normalize(grammarPointNode.path("id").asText(""));
            if (!id.isEmpty()) {
                grammarPoints.add(new CurriculumPoint(
                        id,
                        grammarPointNode.path("description").asText(""),
                        levelKey,
                        grammarPointNode.path("learning_order").asInt(position)));
            }
            position++;
        }

        // stable sort, so equal learning orders keep document order
        grammarPoints.sort(Comparator.comparingInt(CurriculumPoint::learningOrder));

        return List.copyOf(grammarPoints);
    }

    private JsonNode loadCurriculum(String language) {
        String languageKey = language == null || language.isBlank() ? "korean" : language.trim().toLowerCase(Locale.ROOT);
        return readCurriculum(languageKey);
    }

    private JsonNode readCurriculum(String language) {
        String location = String.format(locationPattern, language);
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Curriculum file not found: {}", location);
            return objectMapper.createObjectNode();
        }

        try (InputStream inputStream = resource.getInputStream()) {
            JsonNode curriculum = objectMapper.readTree(inputStream);
            log.info("Loaded {} curriculum from {}", language, location);
            return curriculum == null ? objectMapper.createObjectNode() : curriculum;
        } catch (IOException ex) {
            String errMsg = "Unable to read curriculum " + location;
            log.error(errMsg, ex);
            throw new MappingException(errMsg, ex);
        }
    }
}
