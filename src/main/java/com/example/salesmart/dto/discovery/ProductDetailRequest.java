package com.example.salesmart.dto.discovery;

import jakarta.validation.constraints.NotBlank;

public record ProductDetailRequest(@NotBlank String productUrl) {
}
