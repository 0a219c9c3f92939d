package org.tasktracker.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.tasktracker.DTO.ProjectRequest;
import org.tasktracker.DTO.ProjectView;
import org.tasktracker.DTO.TaskView;
import org.tasktracker.auth.Identity;
import org.tasktracker.entity.Project;
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
public class ProjectService {

    private static final Logger logger = LoggerFactory.getLogger(ProjectService.class);

    @Autowired
    private ProjectRepository projectRepository;

    @Autowired
    private TaskRepository taskRepository;

    @Autowired
    private UserRepository userRepository;

    @Transactional(readOnly = true)
    public List<ProjectView> listProjects() {
        return projectRepository.findAllByOrderByIdAsc().stream()
                .map(ProjectView::from)
                .toList();
    }

    /**
     * 查询单个项目，带出项目经理和全部任务（含负责人）。
     */
    @Transactional(readOnly = true)
    public ProjectView getProject(Long id) {
        Project project = projectRepository.findWithManagerById(id)
                .orElseThrow(() -> projectNotFound());
        List<TaskView> tasks = taskRepository.findByProjectIdOrderByIdAsc(id).stream()
                .map(TaskView::from)
                .toList();
        return ProjectView.from(project, tasks);
    }

    /**
     * 创建项目，创建者即为项目经理。
     */
    @Transactional
    public ProjectView createProject(ProjectRequest request, Identity creator) {
        if (request == null) {
            throw new CustomException(ErrorCode.VALIDATION_ERROR, "Request body is required");
        }
        ValidationUtils.requireText(request.name(), "name", ValidationUtils.TEXT_MAX_LENGTH);
        ValidationUtils.checkLength(request.status(), "status", ValidationUtils.STATUS_MAX_LENGTH);
        User manager = userRepository.findById(creator.id())
                .orElseThrow(() -> new CustomException(ErrorCode.INVALID_REFERENCE, "Manager user does not exist"));

        Project project = new Project();
        project.setName(request.name().trim());
        project.setDescription(request.description());
        project.setStatus(isBlank(request.status()) ? Project.DEFAULT_STATUS : request.status());
        project.setManager(manager);

        Project saved = projectRepository.save(project);
        logger.info("Project created: id={}, managerId={}", saved.getId(), manager.getId());
        return ProjectView.from(saved);
    }

    /**
     * 部分更新：只修改请求中给出的字段，最后写入者生效。
     */
    @Transactional
    public ProjectView updateProject(Long id, ProjectRequest request) {
        Project project = projectRepository.findWithManagerById(id)
                .orElseThrow(() -> projectNotFound());
        if (request != null) {
            if (request.name() != null) {
                if (request.name().isBlank()) {
                    throw new CustomException(ErrorCode.VALIDATION_ERROR, "name must not be blank");
                }
                ValidationUtils.checkLength(request.name(), "name", ValidationUtils.TEXT_MAX_LENGTH);
                project.setName(request.name().trim());
            }
            if (request.description() != null) {
                project.setDescription(request.description());
            }
            if (request.status() != null) {
                if (request.status().isBlank()) {
                    throw new CustomException(ErrorCode.VALIDATION_ERROR, "status must not be blank");
                }
                ValidationUtils.checkLength(request.status(), "status", ValidationUtils.STATUS_MAX_LENGTH);
                project.setStatus(request.status());
            }
        }
        Project saved = projectRepository.saveAndFlush(project);
        return ProjectView.from(saved);
    }

    /**
     * 物理删除项目。项目下仍有任务时拒绝删除，需先删除任务。
     */
    @Transactional
    public void deleteProject(Long id) {
        Project project = projectRepository.findById(id)
                .orElseThrow(() -> projectNotFound());
        long taskCount = taskRepository.countByProjectId(id);
        if (taskCount > 0) {
            throw new CustomException(ErrorCode.CONFLICT,
                    "Project still has " + taskCount + " task(s); delete them first");
        }
        try {
            projectRepository.delete(project);
            projectRepository.flush();
        } catch (DataIntegrityViolationException e) {
            if (!SqlErrorUtils.isForeignKeyViolation(e)) {
                throw e;
            }
            // 检查之后又有任务并发写入，由外键约束兜底
            throw new CustomException(ErrorCode.CONFLICT, "Project still has tasks; delete them first");
        }
        logger.info("Project deleted: id={}", id);
    }

    private static CustomException projectNotFound() {
        return new CustomException(ErrorCode.NOT_FOUND, "Project not found");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
