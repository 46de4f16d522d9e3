package com.example.supermarket.order;

import java.util.Arrays;

/**
 * Values accepted by the {@code orders.status} column. Moving between them is
 * unrestricted at this layer.
 */
public enum OrderStatus {
  PENDING("pending"),
  PAID("paid"),
  SHIPPED("shipped"),
  COMPLETED("completed"),
  CANCELLED("cancelled");

  private final String dbValue;

  OrderStatus(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  public static OrderStatus fromDbValue(String value) {
    return Arrays.stream(values())
        .filter(s -> s.dbValue.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown order status: " + value));
  }
}
