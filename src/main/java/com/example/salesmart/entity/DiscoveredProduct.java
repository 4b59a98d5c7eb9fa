package com.example.salesmart.entity;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Product imported by a discovery run. One row per (project, product key),
 * the key being the normalized product URL.
 */
@Entity
@Table(name = "discovered_products", uniqueConstraints = @UniqueConstraint(name = "uq_discovered_project_key", columnNames = {
        "project_id", "product_key" }))
@Getter
@Setter
@NoArgsConstructor
public class DiscoveredProduct {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false)
    private Long projectId;

    @Column(name = "platform", nullable = false, length = 20)
    private String platform; // lazada/tiki/shopee

    @Column(name = "product_name", nullable = false, length = 1000)
    private String productName;

    @Column(name = "product_url", nullable = false, length = 2000)
    private String productUrl;

    @Column(name = "product_key", nullable = false, length = 2000)
    private String productKey;

    @Column(name = "price_current", nullable = false, precision = 14, scale = 2)
    private BigDecimal priceCurrent;

    @Column(name = "rating_score")
    private Double ratingScore;

    @Column(name = "review_count")
    private Integer reviewCount;

    @Column(name = "sales_count")
    private Long salesCount;

    @Column(name = "is_mall", nullable = false)
    private boolean mall;

    @Column(name = "brand")
    private String brand;

    @Column(name = "seller_location")
    private String sellerLocation;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "keywords")
    private List<String> keywords = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "image_urls")
    private List<String> imageUrls = new ArrayList<>();

    @Column(name = "source_search_url", length = 2000)
    private String sourceSearchUrl;

    @Column(name = "discovery_run_id", length = 64)
    private String discoveryRunId;

    @Column(name = "status", nullable = false, length = 20)
    private String status = "NEW"; // NEW/REVIEWED/REJECTED

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null)
            createdAt = OffsetDateTime.now();
        if (status == null)
            status = "NEW";
        if (keywords == null)
            keywords = new ArrayList<>();
        if (imageUrls == null)
            imageUrls = new ArrayList<>();
    }
}
