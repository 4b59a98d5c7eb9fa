package com.example.salesmart.ops;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SystemFlagService {

    private final SystemFlagRepository repo;

    public SystemFlagService(SystemFlagRepository repo) {
        this.repo = repo;
    }

    /**
     * Value for the key, or null when the flag is not set.
     */
    @Transactional(readOnly = true)
    public String get(String key) {
        return repo.findById(key).map(SystemFlag::getValue).orElse(null);
    }

    @Transactional
    public void set(String key, String value) {
        SystemFlag flag = repo.findById(key).orElseGet(() -> new SystemFlag(key));
        flag.setValue(value);
        repo.save(flag);
    }
}
