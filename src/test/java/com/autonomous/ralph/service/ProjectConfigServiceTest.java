package com.autonomous.ralph.service;

import com.autonomous.ralph.model.ProjectConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectConfigServiceTest {

    @TempDir
    Path configDir;

    private ProjectConfigService load() {
        ProjectConfigService service = new ProjectConfigService();
        service.setConfigPath(configDir.toString());
        service.loadConfigs();
        return service;
    }

    @Test
    void shouldLoadSnakeCaseYaml() throws IOException {
        Files.writeString(configDir.resolve("web.yaml"), """
            name: web
            description: Marketing site
            path: /srv/web
            ralph_dir: tools/ralph
            post_deploy: npm run build
            git:
              remote: upstream
              branch: develop
              auto_push: false
            structure:
              primary_app: apps/site
              key_paths:
                pages: apps/site/pages
              critical_files:
                server: apps/site/server.js
              warnings:
                - Never edit dist/
            """);

        ProjectConfig web = load().getProject("web").orElseThrow();

        assertEquals("/srv/web", web.getPath());
        assertEquals("tools/ralph", web.getRalphDir());
        assertEquals("npm run build", web.getPostDeploy());
        assertEquals("upstream", web.getGit().getRemote());
        assertEquals("develop", web.getGit().getBranch());
        assertFalse(web.getGit().isAutoPush());
        assertEquals("apps/site", web.getStructure().getPrimaryApp());
        assertEquals("apps/site/pages", web.getStructure().getKeyPaths().get("pages"));
        assertEquals(List.of("Never edit dist/"), web.getStructure().getWarnings());
    }

    @Test
    void shouldDefaultNameToFileName() throws IOException {
        Files.writeString(configDir.resolve("api.yml"), "path: /srv/api\n");

        ProjectConfigService service = load();

        assertTrue(service.isConfigured("api"));
        assertEquals("scripts/ralph", service.getProject("api").orElseThrow().getRalphDir());
    }

    @Test
    void shouldSkipMalformedFilesAndOrderByFileName() throws IOException {
        Files.writeString(configDir.resolve("zeta.yaml"), "path: /srv/zeta\n");
        Files.writeString(configDir.resolve("alpha.yaml"), "path: /srv/alpha\n");
        Files.writeString(configDir.resolve("broken.yaml"), "path: [unclosed\n");
        Files.writeString(configDir.resolve("notes.txt"), "not a project\n");

        assertEquals(List.of("alpha", "zeta"), load().getProjectNames());
    }

    @Test
    void shouldTolerateMissingDirectory() {
        ProjectConfigService service = new ProjectConfigService();
        service.setConfigPath(configDir.resolve("missing").toString());
        service.loadConfigs();

        assertTrue(service.getProjectNames().isEmpty());
        assertTrue(service.getProject("web").isEmpty());
    }

    @Test
    void shouldRenderPromptHints() {
        ProjectConfig.Structure structure = new ProjectConfig.Structure();
        structure.getWarnings().add("Backend lives in services/api");
        structure.getCriticalFiles().put("entry", "services/api/main.go");

        assertEquals("\n\nCRITICAL PATH REMINDERS:\n- Backend lives in services/api"
            + "\n\nKEY FILES:\n- entry: services/api/main.go", structure.toPromptHints());
        assertEquals("", new ProjectConfig.Structure().toPromptHints());
    }
}
