package com.gt.tutor.conf;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.tutor.curriculum.CurriculumProvider;
import com.gt.tutor.curriculum.impl.CurriculumProviderJson;
import com.gt.tutor.model.LearningPreferences;
import com.gt.tutor.profile.ProfileDao;
import com.gt.tutor.profile.impl.ProfileDaoFile;
import com.gt.tutor.vocab.VocabularyProvider;
import com.gt.tutor.vocab.impl.VocabularyProviderJson;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class BeanConfig {

    @Bean
    public Clock getClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ProfileDao getProfileDao(ObjectMapper objectMapper,
                                    LearningPreferences defaultLearningPreferences,
                                    @Value("${tutor.profile.path:user_profile.json}") String profilePath) {
        return new ProfileDaoFile(objectMapper, Path.of(profilePath), defaultLearningPreferences);
    }

    @Bean
    public CurriculumProvider getCurriculumProvider(ObjectMapper objectMapper,
                                                    ResourceLoader resourceLoader,
                                                    @Value("${tutor.curriculum.locationPattern:classpath:curriculum/%s.json}") String locationPattern) {
        return new CurriculumProviderJson(objectMapper, resourceLoader, locationPattern);
    }

    @Bean
    public VocabularyProvider getVocabularyProvider(ObjectMapper objectMapper,
                                                    @Value("${tutor.vocab.location:classpath:vocab_data.json}") Resource vocabResource) {
        return new VocabularyProviderJson(objectMapper, vocabResource);
    }
}
