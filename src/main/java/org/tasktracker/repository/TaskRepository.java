package org.tasktracker.repository;

import org.tasktracker.entity.Task;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TaskRepository extends JpaRepository<Task, Long> {

    /**
     * 根据项目 ID 查询任务，并抓取被指派的用户。
     *
     * @param projectId 项目 ID
     * @return 按 ID 升序的任务列表
     */
    @EntityGraph(attributePaths = "assignedUser")
    List<Task> findByProjectIdOrderByIdAsc(Long projectId);

    @EntityGraph(attributePaths = "assignedUser")
    Optional<Task> findWithAssignedUserById(Long id);

    long countByProjectId(Long projectId);
}
