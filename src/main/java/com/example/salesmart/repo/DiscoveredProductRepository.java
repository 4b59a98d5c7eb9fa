package com.example.salesmart.repo;

import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.salesmart.entity.DiscoveredProduct;

@Repository
public interface DiscoveredProductRepository extends JpaRepository<DiscoveredProduct, Long> {

    /**
     * Product keys among {@code keys} already imported for the project (one query per batch).
     */
    @Query("""
            SELECT d.productKey FROM DiscoveredProduct d
            WHERE d.projectId = :projectId
              AND d.productKey IN :keys
            """)
    List<String> findExistingKeys(@Param("projectId") Long projectId, @Param("keys") Collection<String> keys);
}
