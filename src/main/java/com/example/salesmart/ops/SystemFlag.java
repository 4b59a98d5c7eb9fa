package com.example.salesmart.ops;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Operator-editable setting, read at request time.
 */
@Entity
@Table(name = "system_flags")
@Getter
@Setter
@NoArgsConstructor
public class SystemFlag {

    @Id
    @Column(name = "flag_key", length = 64)
    private String key;

    @Column(name = "flag_value", length = 1000)
    private String value;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public SystemFlag(String key) {
        this.key = key;
    }

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = LocalDateTime.now();
    }
}
