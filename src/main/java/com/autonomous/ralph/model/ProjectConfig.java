package com.autonomous.ralph.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectConfig {
    private String name;
    private String description;

    // Worker-local settings
    private String path;
    private String ralphDir = "scripts/ralph";
    private GitSettings git;
    private String postDeploy;

    private Structure structure = new Structure();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GitSettings {
        private String remote = "origin";
        private String branch = "main";
        private boolean autoPush = true;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Structure {
        private String description;
        private String primaryApp;
        private String serverEntry;
        private String frontendEntry;
        private String backendEntry;
        private Map<String, String> keyPaths = new LinkedHashMap<>();
        private Map<String, String> criticalFiles = new LinkedHashMap<>();
        private List<String> warnings = new ArrayList<>();

        /**
         * Renders the path reminders and key files appended to a task prompt.
         */
        public String toPromptHints() {
            StringBuilder hints = new StringBuilder();
            if (warnings != null && !warnings.isEmpty()) {
                hints.append("\n\nCRITICAL PATH REMINDERS:");
                for (String warning : warnings) {
                    hints.append("\n- ").append(warning);
                }
            }
            if (criticalFiles != null && !criticalFiles.isEmpty()) {
                hints.append("\n\nKEY FILES:");
                criticalFiles.forEach((label, file) -> hints.append("\n- ").append(label).append(": ").append(file));
            }
            return hints.toString();
        }
    }
}
