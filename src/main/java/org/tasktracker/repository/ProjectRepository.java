package org.tasktracker.repository;

import org.tasktracker.entity.Project;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProjectRepository extends JpaRepository<Project, Long> {

    /**
     * 查询全部项目，同时抓取项目经理，避免 N+1。
     */
    @EntityGraph(attributePaths = "manager")
    List<Project> findAllByOrderByIdAsc();

    @EntityGraph(attributePaths = "manager")
    Optional<Project> findWithManagerById(Long id);
}
