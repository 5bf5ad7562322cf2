package com.gt.tutor.task;

import com.gt.tutor.model.Profile;
import com.gt.tutor.profile.ProfileService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

@Component
public class ProfileMaintenanceTask {

    private static final Logger log = LoggerFactory.getLogger(ProfileMaintenanceTask.class);

    private final ProfileService profileService;
    private final Clock clock;

    public ProfileMaintenanceTask(ProfileService profileService, Clock clock) {
        this.profileService = profileService;
        this.clock = clock;
    }

    // Loading normalizes keys and repairs items; saving writes the result back
    @Scheduled(cron = "${tutor.maintenance.cron:@daily}")
    public void performProfileMaintenance() {
        LocalDate today = LocalDate.now(clock);

        Profile profile = profileService.load(today);
        profileService.save(profile);

        log.info("Profile maintenance complete for {}", today);
    }
}
