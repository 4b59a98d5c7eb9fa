package com.example.salesmart.dto.discovery;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record AutoDiscoveryRequest(
        @NotNull Long projectId,
        @NotBlank String userInput) {
}
