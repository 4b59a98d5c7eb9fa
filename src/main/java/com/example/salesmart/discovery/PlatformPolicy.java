package com.example.salesmart.discovery;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.salesmart.config.DiscoveryProperties;
import com.example.salesmart.ops.SystemFlagService;

/**
 * Which platforms a run may use. The {@code DISCOVERY_DISABLED_PLATFORMS}
 * system flag (comma separated tags) overrides discovery.disabled-platforms.
 */
@Component
public class PlatformPolicy {

    public static final String DISABLED_PLATFORMS_FLAG = "DISCOVERY_DISABLED_PLATFORMS";

    private static final Logger log = LoggerFactory.getLogger(PlatformPolicy.class);

    private final DiscoveryProperties props;
    private final SystemFlagService flags;

    public PlatformPolicy(DiscoveryProperties props, SystemFlagService flags) {
        this.props = props;
        this.flags = flags;
    }

    public Set<Platform> disabledPlatforms() {
        String override = flags.get(DISABLED_PLATFORMS_FLAG);
        if (override == null) {
            return toSet(props.getDisabledPlatforms());
        }
        Set<Platform> disabled = EnumSet.noneOf(Platform.class);
        for (String tag : override.split(",")) {
            if (tag.isBlank()) {
                continue;
            }
            Platform.fromTag(tag).ifPresentOrElse(disabled::add,
                    () -> log.warn("[PlatformPolicy] ignoring unknown platform in {}: {}", DISABLED_PLATFORMS_FLAG, tag));
        }
        return disabled;
    }

    public Set<Platform> enabledPlatforms() {
        Set<Platform> enabled = EnumSet.allOf(Platform.class);
        enabled.removeAll(disabledPlatforms());
        return enabled;
    }

    public boolean isEnabled(Platform platform) {
        return !disabledPlatforms().contains(platform);
    }

    /**
     * Requested platforms that are still enabled, or the configured fallback
     * set when none remain. Order of the request is preserved.
     */
    public List<Platform> substitutesFor(Collection<Platform> requested) {
        Set<Platform> disabled = disabledPlatforms();
        Set<Platform> remaining = new LinkedHashSet<>();
        for (Platform p : requested) {
            if (!disabled.contains(p)) {
                remaining.add(p);
            }
        }
        if (remaining.isEmpty()) {
            for (Platform p : props.getFallbackPlatforms()) {
                if (!disabled.contains(p)) {
                    remaining.add(p);
                }
            }
        }
        return List.copyOf(remaining);
    }

    private static Set<Platform> toSet(Collection<Platform> platforms) {
        if (platforms == null || platforms.isEmpty()) {
            return EnumSet.noneOf(Platform.class);
        }
        return EnumSet.copyOf(platforms);
    }

    static String describe(Collection<Platform> platforms) {
        return Arrays.toString(platforms.stream().map(Platform::tag).toArray());
    }
}
