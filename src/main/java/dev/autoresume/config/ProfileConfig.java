package dev.autoresume.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.io.IOException;

/**
 * Configuration for loading the ResumeProfile from the configured JSON file.
 */
@Slf4j
@Configuration
public class ProfileConfig {

    @Bean
    public ResumeProfile resumeProfile(ObjectMapper objectMapper, ResumeConfig resumeConfig) {
        File file = new File(resumeConfig.getProfilePath());
        if (!file.exists()) {
            throw new IllegalStateException("Profile not found at " + file.getAbsolutePath()
                    + ". Create it or point resume.profile-path at an existing file.");
        }

        try {
            ResumeProfile profile = objectMapper.readValue(file, ResumeProfile.class);
            if (profile.getFullName() == null || profile.getFullName().isBlank()) {
                throw new IllegalStateException("Profile " + file + " has no fullName");
            }
            log.info("Loaded resume profile for: {}", profile.getFullName());
            return profile;
        } catch (IOException e) {
            log.error("Failed to load {}. Ensure it matches the required structure.", file, e);
            throw new IllegalStateException("Could not load resume profile", e);
        }
    }
}
