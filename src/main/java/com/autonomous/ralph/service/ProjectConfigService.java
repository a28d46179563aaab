package com.autonomous.ralph.service;

import com.autonomous.ralph.model.ProjectConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads project definitions from {@code <ralph.projects.path>/*.yaml}.
 *
 * <p>The project name defaults to the file name without extension. The hub uses
 * these for validation and prompt hints; a worker uses them for local paths and
 * git settings.
 */
@Slf4j
@Service
public class ProjectConfigService {

    @Value("${ralph.projects.path:config/projects}")
    private String configPath;

    private final Map<String, ProjectConfig> projects = new LinkedHashMap<>();
    private final ObjectMapper yamlMapper;

    public ProjectConfigService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public void setConfigPath(String path) {
        this.configPath = path;
    }

    @PostConstruct
    public synchronized void loadConfigs() {
        projects.clear();
        File configDir = new File(configPath);

        if (!configDir.exists() || !configDir.isDirectory()) {
            log.info("Project config directory not found: {}", configPath);
            return;
        }

        File[] yamlFiles = configDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
        if (yamlFiles == null) return;

        Arrays.sort(yamlFiles);
        for (File file : yamlFiles) {
            try {
                ProjectConfig config = yamlMapper.readValue(file, ProjectConfig.class);
                if (config.getName() == null || config.getName().isBlank()) {
                    config.setName(file.getName().replaceFirst("\\.ya?ml$", ""));
                }
                projects.put(config.getName(), config);
                log.info("Loaded project {} ({})", config.getName(),
                    config.getPath() != null ? config.getPath() : "no local path");
            } catch (Exception e) {
                log.warn("Failed to load project config from {}: {}", file.getName(), e.getMessage());
            }
        }
    }

    public synchronized Optional<ProjectConfig> getProject(String name) {
        return Optional.ofNullable(projects.get(name));
    }

    public synchronized boolean isConfigured(String name) {
        return projects.containsKey(name);
    }

    public synchronized List<String> getProjectNames() {
        return List.copyOf(projects.keySet());
    }

    public synchronized Map<String, ProjectConfig> getAllProjects() {
        return new LinkedHashMap<>(projects);
    }
}
