package com.example.supermarket.order;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

public record NewOrderItem(
    @Size(max = 64) String productId,
    @NotBlank @Size(max = 200) String title,
    @NotNull @DecimalMin("0.00") @Digits(integer = 10, fraction = 2) BigDecimal price,
    @Min(1) int quantity,
    @Size(max = 500) String image
) {}
