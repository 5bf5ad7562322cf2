package com.gt.tutor.profile.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StoredSessionTracking {

    private final Integer sessionsStarted;
    private final Integer sessionsSinceNewContent;
    private final String lastSessionDate;
    private final Integer exercisesCompleted;
    private final Integer correctExercises;
    private final Map<String, Object> otherProperties;

    @JsonCreator
    public StoredSessionTracking(@JsonProperty("sessions_started") Integer sessionsStarted,
                                 @JsonProperty("sessions_since_new_content") Integer sessionsSinceNewContent,
                                 @JsonProperty("last_session_date") String lastSessionDate,
                                 @JsonProperty("exercises_completed") Integer exercisesCompleted,
                                 @JsonProperty("correct_exercises") Integer correctExercises) {
        this(sessionsStarted, sessionsSinceNewContent, lastSessionDate, exercisesCompleted, correctExercises, Map.of());
    }

    public StoredSessionTracking(Integer sessionsStarted,
                                 Integer sessionsSinceNewContent,
                                 String lastSessionDate,
                                 Integer exercisesCompleted,
                                 Integer correctExercises,
                                 Map<String, Object> otherProperties) {
        this.sessionsStarted = sessionsStarted;
        this.sessionsSinceNewContent = sessionsSinceNewContent;
        this.lastSessionDate = lastSessionDate;
        this.exercisesCompleted = exercisesCompleted;
        this.correctExercises = correctExercises;
        this.otherProperties = new LinkedHashMap<>(otherProperties);
    }

    @JsonProperty("sessions_started")
    public Integer sessionsStarted() {
        return sessionsStarted;
    }

    @JsonProperty("sessions_since_new_content")
    public Integer sessionsSinceNewContent() {
        return sessionsSinceNewContent;
    }

    @JsonProperty("last_session_date")
    public String lastSessionDate() {
        return lastSessionDate;
    }

    @JsonProperty("exercises_completed")
    public Integer exercisesCompleted() {
        return exercisesCompleted;
    }

    @JsonProperty("correct_exercises")
    public Integer correctExercises() {
        return correctExercises;
    }

    @JsonAnyGetter
    public Map<String, Object> otherProperties() {
        return otherProperties;
    }

    @JsonAnySetter
    void putOtherProperty(String name, Object value) {
        otherProperties.put(name, value);
    }
}
