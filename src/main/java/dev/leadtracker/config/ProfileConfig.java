package dev.leadtracker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.io.IOException;

/**
 * Configuration for loading the UserProfile from profile.json.
 */
@Slf4j
@Configuration
public class ProfileConfig {

  @Bean
  public UserProfile userProfile(ObjectMapper objectMapper,
      @Value("${profile.file:profile.json}") String profileFile) {
    File file = new File(profileFile);
    if (!file.exists()) {
      log.warn("{} not found. Using default empty profile; every lead will pass the filter.", profileFile);
      return new UserProfile();
    }

    try {
      UserProfile profile = objectMapper.readValue(file, UserProfile.class);
      log.info("Loaded user profile for: {}", profile.getName());
      return profile;
    } catch (IOException e) {
      log.error("Failed to load {}. Ensure it matches the required structure.", profileFile, e);
      throw new IllegalStateException("Could not load user profile", e);
    }
  }
}
