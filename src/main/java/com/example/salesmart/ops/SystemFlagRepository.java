package com.example.salesmart.ops;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SystemFlagRepository extends JpaRepository<SystemFlag, String> {
}
