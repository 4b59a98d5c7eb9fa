package com.example.salesmart.repo;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.salesmart.entity.StateTransition;

@Repository
public interface StateTransitionRepository extends JpaRepository<StateTransition, Long> {

    @Query("""
            SELECT s FROM StateTransition s
            WHERE s.entityType = :entityType
              AND s.entityId = :entityId
            ORDER BY s.createdAt DESC
            """)
    List<StateTransition> findRecentByEntity(
            @Param("entityType") String entityType,
            @Param("entityId") Long entityId,
            Pageable pageable);
}
