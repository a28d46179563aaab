package com.autonomous.ralph.controller;

import com.autonomous.ralph.model.HubStatus;
import com.autonomous.ralph.model.ProjectConfig;
import com.autonomous.ralph.model.Task;
import com.autonomous.ralph.model.TriggerRequest;
import com.autonomous.ralph.model.TriggerResult;
import com.autonomous.ralph.service.ProjectConfigService;
import com.autonomous.ralph.service.TaskDispatcherService;
import com.autonomous.ralph.service.WorkerRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/ralph")
@Profile("!worker")
public class RalphController {

    @Autowired
    private TaskDispatcherService dispatcher;

    @Autowired
    private ProjectConfigService projectConfigs;

    @Autowired
    private WorkerRegistry registry;

    // Rejections are still 200: callers read success/error from the body
    @PostMapping("/trigger")
    public ResponseEntity<TriggerResult> trigger(@RequestBody TriggerRequest request) {
        String requestedBy = request.getRequestedBy() != null ? request.getRequestedBy() : "api";
        return ResponseEntity.ok(dispatcher.trigger(request.getProject(), request.getInstructionText(),
            request.getPrd(), requestedBy));
    }

    @PostMapping("/tasks/{id}/cancel")
    public ResponseEntity<?> cancel(@PathVariable long id) {
        return ResponseEntity.ok(Map.of("success", dispatcher.cancel(id)));
    }

    @PostMapping("/clear-stuck")
    public ResponseEntity<?> clearStuck(@RequestParam(defaultValue = "30") long thresholdMinutes) {
        int cleared = dispatcher.clearStuck(thresholdMinutes);
        return ResponseEntity.ok(Map.of("success", true, "cleared", cleared));
    }

    @GetMapping("/tasks")
    public List<Task> tasks(@RequestParam(required = false) String project,
                            @RequestParam(defaultValue = "10") int limit) {
        return dispatcher.tasks(project, limit);
    }

    @GetMapping("/tasks/{id}")
    public ResponseEntity<Task> task(@PathVariable long id) {
        return dispatcher.task(id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/status")
    public HubStatus status() {
        return dispatcher.status();
    }

    /**
     * Projects configured on the hub followed by those only advertised by workers.
     */
    @GetMapping("/projects")
    public List<Map<String, Object>> projects() {
        List<Map<String, Object>> result = new ArrayList<>();
        Map<String, ProjectConfig> configured = projectConfigs.getAllProjects();
        List<String> advertised = registry.advertisedProjects();

        for (ProjectConfig config : configured.values()) {
            result.add(describe(config.getName(), config.getPath(), advertised.contains(config.getName())));
        }
        for (String name : advertised) {
            if (!configured.containsKey(name)) {
                result.add(describe(name, null, true));
            }
        }
        return result;
    }

    private Map<String, Object> describe(String id, String path, boolean available) {
        Map<String, Object> project = new LinkedHashMap<>();
        project.put("id", id);
        project.put("name", id.isEmpty() ? id : Character.toUpperCase(id.charAt(0)) + id.substring(1));
        project.put("path", path);
        project.put("available", available);
        return project;
    }
}
