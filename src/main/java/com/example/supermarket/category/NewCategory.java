package com.example.supermarket.category;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record NewCategory(
    @NotBlank @Size(max = 120) String name,
    @NotBlank @Size(max = 120) String slug,
    @Size(max = 120) String icon
) {}
