package com.example.salesmart.dto.discovery;

import java.util.List;

import com.example.salesmart.discovery.Platform;

import jakarta.validation.constraints.NotNull;

public record DisabledPlatformsRequest(@NotNull List<@NotNull Platform> disabled) {
}
