package com.gt.tutor.profile;

import com.gt.tutor.model.Profile;

import java.util.Optional;

public interface ProfileDao {

    // Empty when no profile has been saved yet
    Optional<Profile> loadProfile();

    void saveProfile(Profile profile);
}
