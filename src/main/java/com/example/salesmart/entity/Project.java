package com.example.salesmart.entity;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Sourcing project. Owned elsewhere; discovery only reads it.
 */
@Entity
@Table(name = "projects")
@Getter
@Setter
@NoArgsConstructor
public class Project {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", length = 4000)
    private String description;

    @Column(name = "target_product_name")
    private String targetProductName;

    @Column(name = "target_product_category")
    private String targetProductCategory;

    @Column(name = "target_budget_range", precision = 14, scale = 2)
    private BigDecimal targetBudgetRange;

    @Column(name = "currency", length = 8)
    private String currency = "VND";

    @Column(name = "status", length = 30)
    private String status;

    @Column(name = "pipeline_type", length = 30)
    private String pipelineType;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null)
            createdAt = OffsetDateTime.now();
        if (currency == null)
            currency = "VND";
    }
}
