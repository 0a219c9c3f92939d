package org.tasktracker.controller;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.tasktracker.DTO.TaskRequest;
import org.tasktracker.DTO.TaskView;
import org.tasktracker.annotation.Guarded;
import org.tasktracker.annotation.LogAction;
import org.tasktracker.service.Operation;
import org.tasktracker.service.TaskService;

import java.util.Map;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    @Autowired
    private TaskService taskService;

    // 所有已认证用户都可以更新任务
    @PutMapping("/{id}")
    @Guarded(Operation.UPDATE_TASK)
    @LogAction(value = "TASK", action = "UPDATE")
    public ResponseEntity<TaskView> updateTask(@PathVariable Long id, @RequestBody TaskRequest request) {
        return ResponseEntity.ok(taskService.updateTask(id, request));
    }

    @DeleteMapping("/{id}")
    @Guarded(Operation.DELETE_TASK)
    @LogAction(value = "TASK", action = "DELETE")
    public ResponseEntity<Map<String, Object>> deleteTask(@PathVariable Long id) {
        taskService.deleteTask(id);
        return ResponseEntity.ok(Map.of("message", "Task deleted successfully"));
    }
}
