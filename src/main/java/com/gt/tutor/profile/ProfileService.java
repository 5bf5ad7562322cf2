package com.gt.tutor.profile;

import com.gt.tutor.model.ItemKind;
import com.gt.tutor.model.LearningItem;
import com.gt.tutor.model.LearningPreferences;
import com.gt.tutor.model.Profile;
import com.gt.tutor.profile.converter.ProfileConverter;
import com.gt.tutor.srs.SrsUpdateEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Owns the load, transform, persist cycle of the profile. Every load renormalizes item keys and repairs item state,
 * so callers only ever see canonical ids and in-range values.
 */
@Component
public class ProfileService {

    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);

    private final ProfileDao profileDao;
    private final ItemKeyMerger itemKeyMerger;
    private final SrsUpdateEngine srsUpdateEngine;
    private final LearningPreferences defaultPreferences;

    @Autowired
    public ProfileService(ProfileDao profileDao,
                          ItemKeyMerger itemKeyMerger,
                          SrsUpdateEngine srsUpdateEngine,
                          LearningPreferences defaultPreferences) {
        this.profileDao = profileDao;
        this.itemKeyMerger = itemKeyMerger;
        this.srsUpdateEngine = srsUpdateEngine;
        this.defaultPreferences = defaultPreferences;
    }

    public Profile load(LocalDate today) {
        Profile storedProfile = profileDao.loadProfile().orElse(null);
        if (storedProfile == null) {
            log.info("No profile found, creating a default profile");
            Profile defaultProfile = Profile.newProfile(ProfileConverter.DEFAULT_USER_ID, ProfileConverter.DEFAULT_LEVEL,
                    ProfileConverter.DEFAULT_TARGET_LANGUAGE, defaultPreferences);
            profileDao.saveProfile(defaultProfile);
            return defaultProfile;
        }

        Profile profile = storedProfile
                .withGrammarSummary(normalizeAndRepair(storedProfile.grammarSummary(), ItemKind.Grammar, today))
                .withVocabSummary(normalizeAndRepair(storedProfile.vocabSummary(), ItemKind.Vocabulary, today))
                .withDifficultyProgress(itemKeyMerger.mergeDifficultyProgress(storedProfile.difficultyProgress()));

        log.info("Loaded profile {} with {} grammar and {} vocabulary item(s)",
                profile.userId(), profile.grammarSummary().size(), profile.vocabSummary().size());

        return profile;
    }

    public void save(Profile profile) {
        profileDao.saveProfile(profile);

        log.info("Saved profile {} with {} grammar and {} vocabulary item(s)",
                profile.userId(), profile.grammarSummary().size(), profile.vocabSummary().size());
    }

    public Profile update(LocalDate today, UnaryOperator<Profile> transform) {
        Profile updated = transform.apply(load(today));
        save(updated);
        return updated;
    }

    private Map<String, LearningItem> normalizeAndRepair(Map<String, LearningItem> summary, ItemKind kind, LocalDate today) {
        Map<String, LearningItem> merged = itemKeyMerger.merge(summary, kind).summary();

        Map<String, LearningItem> repaired = new LinkedHashMap<>();
        for (Map.Entry<String, LearningItem> entry : merged.entrySet()) {
            repaired.put(entry.getKey(), srsUpdateEngine.repair(entry.getValue(), today));
        }
        return repaired;
    }
}
