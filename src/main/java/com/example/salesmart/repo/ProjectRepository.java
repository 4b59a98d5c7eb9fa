package com.example.salesmart.repo;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.salesmart.entity.Project;

@Repository
public interface ProjectRepository extends JpaRepository<Project, Long> {
}
