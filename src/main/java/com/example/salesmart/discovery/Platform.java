package com.example.salesmart.discovery;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of marketplaces. A platform can be disabled at runtime without
 * leaving the enum (see {@link PlatformPolicy}).
 */
public enum Platform {

    LAZADA("lazada", "lazada.vn"),
    TIKI("tiki", "tiki.vn"),
    SHOPEE("shopee", "shopee.vn");

    private final String tag;
    private final String hostMarker;

    Platform(String tag, String hostMarker) {
        this.tag = tag;
        this.hostMarker = hostMarker;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public String hostMarker() {
        return hostMarker;
    }

    @JsonCreator
    public static Platform fromJson(String value) {
        return fromTag(value).orElseThrow(() -> new IllegalArgumentException("Unknown platform: " + value));
    }

    public static Optional<Platform> fromTag(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Platform p : values()) {
            if (p.tag.equals(normalized)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    public static Optional<Platform> fromUrl(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String lower = url.toLowerCase(Locale.ROOT);
        for (Platform p : values()) {
            if (lower.contains(p.hostMarker)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
