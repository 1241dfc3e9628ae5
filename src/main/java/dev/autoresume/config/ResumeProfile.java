package dev.autoresume.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.autoresume.model.ResumeItem;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Personal information and hand-written resume sections, loaded from profile.json.
 * Sections here are used whenever the generator leaves the matching section empty.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResumeProfile {
    private String fullName;
    private String city = "";
    private String country = "";
    private String email;
    private String phone;
    private String linkedin;
    private String github;
    private String site;
    private List<ResumeItem> education = new ArrayList<>();
    private List<ResumeItem> skills = new ArrayList<>();
    private List<ResumeItem> experience = new ArrayList<>();
    private List<ResumeItem> projects = new ArrayList<>();
    private String educationContext;
    private String experienceContext;
    private String skillsContext;
}
