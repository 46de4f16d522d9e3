package com.example.supermarket.order;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.List;

/**
 * Amounts are stored exactly as given; nothing here derives the total from the
 * other fields.
 */
public record NewOrder(
    @NotBlank @Size(max = 160) String buyerName,
    @NotBlank @Email @Size(max = 160) String buyerEmail,
    @NotBlank String buyerAddress,
    @NotNull @Digits(integer = 10, fraction = 2) BigDecimal subtotal,
    @NotNull @Digits(integer = 10, fraction = 2) BigDecimal discount,
    @NotNull @Digits(integer = 10, fraction = 2) BigDecimal deliveryFee,
    @NotNull @Digits(integer = 10, fraction = 2) BigDecimal total,
    OrderStatus status,
    @Size(max = 64) String couponCode,
    @NotNull List<@NotNull @Valid NewOrderItem> items
) {}
