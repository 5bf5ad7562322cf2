package com.gt.tutor.profile.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.tutor.exception.DaoException;
import com.gt.tutor.model.LearningPreferences;
import com.gt.tutor.model.Profile;
import com.gt.tutor.profile.ProfileDao;
import com.gt.tutor.profile.converter.ProfileConverter;
import com.gt.tutor.profile.model.StoredProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps the profile as one JSON document on disk. A save writes a temporary file next to the target and moves it
 * into place, so readers never observe a partially written document.
 */
public class ProfileDaoFile implements ProfileDao {

    private static final Logger log = LoggerFactory.getLogger(ProfileDaoFile.class);

    private final ObjectMapper objectMapper;
    private final Path profilePath;
    private final LearningPreferences defaultPreferences;

    public ProfileDaoFile(ObjectMapper objectMapper, Path profilePath, LearningPreferences defaultPreferences) {
        this.objectMapper = objectMapper;
        this.profilePath = profilePath.toAbsolutePath();
        this.defaultPreferences = defaultPreferences;
    }

    @Override
    public Optional<Profile> loadProfile() {
        if (!Files.exists(profilePath)) {
            return Optional.empty();
        }

        try {
            String content = Files.readString(profilePath, StandardCharsets.UTF_8);
            if (content.isBlank()) {
                log.warn("Profile file {} is empty, treating it as missing", profilePath);
                return Optional.empty();
            }

            StoredProfile storedProfile = objectMapper.readValue(content, StoredProfile.class);
            if (storedProfile == null) {
                log.warn("Profile file {} holds a null document, treating it as missing", profilePath);
                return Optional.empty();
            }

            return Optional.of(ProfileConverter.convertStoredProfile(storedProfile, defaultPreferences));
        } catch (IOException ex) {
            String errMsg = "Unable to read profile " + profilePath;
            log.error(errMsg, ex);
            throw new DaoException(errMsg, ex);
        }
    }

    @Override
    public void saveProfile(Profile profile) {
        Path directory = profilePath.getParent();
        Path tempFile = null;

        try {
            Files.createDirectories(directory);
            tempFile = Files.createTempFile(directory, profilePath.getFileName().toString(), ".tmp");

            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(tempFile.toFile(), ProfileConverter.convertProfile(profile));

            moveIntoPlace(tempFile);
            tempFile = null;
        } catch (IOException ex) {
            String errMsg = "Unable to save profile " + profilePath;
            log.error(errMsg, ex);
            throw new DaoException(errMsg, ex);
        } finally {
            deleteQuietly(tempFile);
        }
    }

    private void moveIntoPlace(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, profilePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            log.warn("Atomic move not supported for {}, falling back to a replacing move", profilePath);
            Files.move(tempFile, profilePath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tempFile) {
        if (tempFile == null) {
            return;
        }

        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException ex) {
            log.warn("Unable to delete temporary profile file " + tempFile, ex);
        }
    }
}
