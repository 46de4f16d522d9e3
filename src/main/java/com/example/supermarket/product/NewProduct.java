package com.example.supermarket.product;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

public record NewProduct(
    @NotBlank @Size(max = 200) String title,
    String description,
    @NotNull @DecimalMin("0.00") @Digits(integer = 10, fraction = 2) BigDecimal price,
    @NotBlank @Size(max = 120) String categorySlug,
    boolean inStock,
    @Size(max = 500) String image,
    @DecimalMin("0.0") @DecimalMax("5.0") @Digits(integer = 2, fraction = 1) BigDecimal rating
) {}
