package dev.leadtracker.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * The job seeker, loaded from profile.json.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserProfile {
  private String name = "Default User";

  /** Free-text summary of experience, used to judge suitability. */
  private String background = "";

  /** General cover-letter instructions applied to every job. */
  private List<String> writingInstructions = new ArrayList<>();

  public boolean hasBackground() {
    return background != null && !background.isBlank();
  }
}
