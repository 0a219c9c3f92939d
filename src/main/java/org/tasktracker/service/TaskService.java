package org.tasktracker.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.tasktracker.DTO.TaskRequest;
import org.tasktracker.DTO.TaskView;
import org.tasktracker.entity.Project;
import org.tasktracker.entity.Task;
import org.tasktracker.entity.User;
import org.tasktracker.exception.CustomException;
import org.tasktracker.exception.ErrorCode;
import org.tasktracker.repository.ProjectRepository;
import org.tasktracker.repository.TaskRepository;
import org.tasktracker.repository.UserRepository;
import org.tasktracker.utils.SqlErrorUtils;
import org.tasktracker.utils.ValidationUtils;

import java.util.List;

@Service
public class TaskService {

    private static final Logger logger = LoggerFactory.getLogger(TaskService.class);

    @Autowired
    private TaskRepository taskRepository;

    @Autowired
    private ProjectRepository projectRepository;

    @Autowired
    private UserRepository userRepository;

    @Transactional(readOnly = true)
    public List<TaskView> listTasks(Long projectId) {
        if (!projectRepository.existsById(projectId)) {
            throw new CustomException(ErrorCode.NOT_FOUND, "Project not found");
        }
        return taskRepository.findByProjectIdOrderByIdAsc(projectId).stream()
                .map(TaskView::from)
                .toList();
    }

    /**
     * 在指定项目下创建任务。项目或负责人不存在时不写入任何数据。
     *
     * @throws CustomException INVALID_REFERENCE 项目或负责人不存在；VALIDATION_ERROR 标题缺失或优先级非法
     */
    @Transactional
    public TaskView createTask(Long projectId, TaskRequest request) {
        if (request == null) {
            throw new CustomException(ErrorCode.VALIDATION_ERROR, "Request body is required");
        }
        ValidationUtils.requireText(request.title(), "title", ValidationUtils.TEXT_MAX_LENGTH);
        ValidationUtils.checkLength(request.status(), "status", ValidationUtils.STATUS_MAX_LENGTH);
        Task.Priority priority = Task.Priority.parse(request.priority());

        Project project = projectRepository.findById(projectId)
                .orElseThrow(() -> new CustomException(ErrorCode.INVALID_REFERENCE,
                        "Project " + projectId + " does not exist"));

        Task task = new Task();
        task.setTitle(request.title().trim());
        task.setDescription(request.description());
        task.setProject(project);
        task.setAssignedUser(resolveAssignee(request.assignedUserId()));
        task.setPriority(priority != null ? priority : Task.Priority.MEDIUM);
        task.setStatus(request.status() == null || request.status().isBlank() ? Task.DEFAULT_STATUS : request.status());

        try {
            Task saved = taskRepository.saveAndFlush(task);
            logger.info("Task created: id={}, projectId={}", saved.getId(), projectId);
            return TaskView.from(saved);
        } catch (DataIntegrityViolationException e) {
            if (!SqlErrorUtils.isForeignKeyViolation(e)) {
                throw e;
            }
            // 项目在检查之后被并发删除
            throw new CustomException(ErrorCode.INVALID_REFERENCE, "Referenced project or user no longer exists");
        }
    }

    /**
     * 部分更新：未提供的字段保持原值。
     */
    @Transactional
    public TaskView updateTask(Long id, TaskRequest request) {
        Task task = taskRepository.findWithAssignedUserById(id)
                .orElseThrow(() -> new CustomException(ErrorCode.NOT_FOUND, "Task not found"));
        if (request != null) {
            if (request.title() != null) {
                if (request.title().isBlank()) {
                    throw new CustomException(ErrorCode.VALIDATION_ERROR, "title must not be blank");
                }
                ValidationUtils.checkLength(request.title(), "title", ValidationUtils.TEXT_MAX_LENGTH);
                task.setTitle(request.title().trim());
            }
            if (request.description() != null) {
                task.setDescription(request.description());
            }
            if (request.status() != null) {
                if (request.status().isBlank()) {
                    throw new CustomException(ErrorCode.VALIDATION_ERROR, "status must not be blank");
                }
                ValidationUtils.checkLength(request.status(), "status", ValidationUtils.STATUS_MAX_LENGTH);
                task.setStatus(request.status());
            }
            if (request.priority() != null) {
                task.setPriority(Task.Priority.parse(request.priority()));
            }
            if (request.assignedUserId() != null) {
                task.setAssignedUser(resolveAssignee(request.assignedUserId()));
            }
        }
        try {
            return TaskView.from(taskRepository.saveAndFlush(task));
        } catch (DataIntegrityViolationException e) {
            if (!SqlErrorUtils.isForeignKeyViolation(e)) {
                throw e;
            }
            throw new CustomException(ErrorCode.INVALID_REFERENCE, "Referenced user no longer exists");
        }
    }

    @Transactional
    public void deleteTask(Long id) {
        Task task = taskRepository.findById(id)
                .orElseThrow(() -> new CustomException(ErrorCode.NOT_FOUND, "Task not found"));
        taskRepository.delete(task);
        logger.info("Task deleted: id={}", id);
    }

    private User resolveAssignee(Long assignedUserId) {
        if (assignedUserId == null) {
            return null;
        }
        return userRepository.findById(assignedUserId)
                .orElseThrow(() -> new CustomException(ErrorCode.INVALID_REFERENCE,
                        "Assigned user " + assignedUserId + " does not exist"));
    }
}
