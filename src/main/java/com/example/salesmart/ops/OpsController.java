package com.example.salesmart.ops;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.salesmart.discovery.Platform;
import com.example.salesmart.discovery.PlatformPolicy;
import com.example.salesmart.dto.discovery.DisabledPlatformsRequest;
import com.example.salesmart.entity.StateTransition;
import com.example.salesmart.repo.StateTransitionRepository;
import com.example.salesmart.service.StateTransitionService;

import jakarta.validation.Valid;

/**
 * Runtime switches and run history for discovery.
 */
@RestController
@RequestMapping("/ops/discovery")
public class OpsController {

    private static final Logger log = LoggerFactory.getLogger(OpsController.class);
    private static final int MAX_RUNS = 100;

    private final PlatformPolicy platformPolicy;
    private final SystemFlagService flags;
    private final StateTransitionService transitions;
    private final StateTransitionRepository transitionRepo;

    public OpsController(
            PlatformPolicy platformPolicy,
            SystemFlagService flags,
            StateTransitionService transitions,
            StateTransitionRepository transitionRepo) {
        this.platformPolicy = platformPolicy;
        this.flags = flags;
        this.transitions = transitions;
        this.transitionRepo = transitionRepo;
    }

    @GetMapping("/platforms")
    public Map<String, Object> platforms() {
        return Map.of(
                "enabled", platformPolicy.enabledPlatforms(),
                "disabled", platformPolicy.disabledPlatforms());
    }

    /**
     * Replaces the disabled set. An empty list enables every platform.
     */
    @PutMapping("/platforms")
    public ResponseEntity<Map<String, Object>> updateDisabledPlatforms(
            @Valid @RequestBody DisabledPlatformsRequest body) {
        Set<Platform> requested = Set.copyOf(body.disabled());
        String value = requested.stream()
                .sorted()
                .map(Platform::tag)
                .collect(Collectors.joining(","));
        flags.set(PlatformPolicy.DISABLED_PLATFORMS_FLAG, value);

        transitions.log(
                "SYSTEM",
                0L,
                null,
                "DISABLED_PLATFORMS_UPDATED",
                "DISABLED_PLATFORMS_UPDATED",
                "value=" + value,
                "SYSTEM",
                UUID.randomUUID().toString().replace("-", ""));
        log.info("[Ops] disabled platforms set to [{}]", value);
        return ResponseEntity.ok(platforms());
    }

    @GetMapping("/runs")
    public List<StateTransition> recentRuns(
            @RequestParam("projectId") Long projectId,
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        int size = Math.max(1, Math.min(MAX_RUNS, limit));
        return transitionRepo.findRecentByEntity(StateTransitionService.ENTITY_DISCOVERY_RUN, projectId,
                PageRequest.of(0, size));
    }
}
