package org.tasktracker.controller;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.tasktracker.DTO.ProjectRequest;
import org.tasktracker.DTO.ProjectView;
import org.tasktracker.DTO.TaskRequest;
import org.tasktracker.DTO.TaskView;
import org.tasktracker.annotation.Guarded;
import org.tasktracker.annotation.LogAction;
import org.tasktracker.auth.Identity;
import org.tasktracker.service.Operation;
import org.tasktracker.service.ProjectService;
import org.tasktracker.service.TaskService;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    @Autowired
    private ProjectService projectService;

    @Autowired
    private TaskService taskService;

    @GetMapping
    @Guarded(Operation.LIST_PROJECTS)
    @LogAction(value = "PROJECT", action = "LIST")
    public ResponseEntity<List<ProjectView>> listProjects() {
        return ResponseEntity.ok(projectService.listProjects());
    }

    @GetMapping("/{id}")
    @Guarded(Operation.READ_PROJECT)
    @LogAction(value = "PROJECT", action = "GET")
    public ResponseEntity<ProjectView> getProject(@PathVariable Long id) {
        return ResponseEntity.ok(projectService.getProject(id));
    }

    @PostMapping
    @Guarded(Operation.CREATE_PROJECT)
    @LogAction(value = "PROJECT", action = "CREATE")
    public ResponseEntity<ProjectView> createProject(@RequestBody ProjectRequest request,
                                                     @AuthenticationPrincipal Identity identity) {
        return ResponseEntity.status(HttpStatus.CREATED).body(projectService.createProject(request, identity));
    }

    @PutMapping("/{id}")
    @Guarded(Operation.UPDATE_PROJECT)
    @LogAction(value = "PROJECT", action = "UPDATE")
    public ResponseEntity<ProjectView> updateProject(@PathVariable Long id, @RequestBody ProjectRequest request) {
        return ResponseEntity.ok(projectService.updateProject(id, request));
    }

    @DeleteMapping("/{id}")
    @Guarded(Operation.DELETE_PROJECT)
    @LogAction(value = "PROJECT", action = "DELETE")
    public ResponseEntity<Map<String, Object>> deleteProject(@PathVariable Long id) {
        projectService.deleteProject(id);
        return ResponseEntity.ok(Map.of("message", "Project deleted successfully"));
    }

    // 项目下的任务
    @GetMapping("/{id}/tasks")
    @Guarded(Operation.LIST_TASKS)
    @LogAction(value = "TASK", action = "LIST")
    public ResponseEntity<List<TaskView>> listTasks(@PathVariable Long id) {
        return ResponseEntity.ok(taskService.listTasks(id));
    }

    @PostMapping("/{id}/tasks")
    @Guarded(Operation.CREATE_TASK)
    @LogAction(value = "TASK", action = "CREATE")
    public ResponseEntity<TaskView> createTask(@PathVariable Long id, @RequestBody TaskRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(taskService.createTask(id, request));
    }
}
