package com.example.salesmart.service;

import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.salesmart.discovery.ProjectContext;
import com.example.salesmart.entity.Project;
import com.example.salesmart.repo.ProjectRepository;

@Service
public class ProjectService {

    private final ProjectRepository projectRepo;

    public ProjectService(ProjectRepository projectRepo) {
        this.projectRepo = projectRepo;
    }

    @Transactional(readOnly = true)
    public Optional<ProjectContext> findContext(Long projectId) {
        if (projectId == null) {
            return Optional.empty();
        }
        return projectRepo.findById(projectId).map(ProjectService::toContext);
    }

    static ProjectContext toContext(Project p) {
        return new ProjectContext(
                p.getId(),
                p.getName(),
                p.getDescription(),
                p.getTargetProductName(),
                p.getTargetProductCategory(),
                p.getTargetBudgetRange(),
                p.getCurrency(),
                p.getStatus(),
                p.getPipelineType());
    }
}
