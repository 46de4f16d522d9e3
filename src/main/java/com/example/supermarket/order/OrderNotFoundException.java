package com.example.supermarket.order;

public class OrderNotFoundException extends RuntimeException {

  private final Long orderId;

  public OrderNotFoundException(Long orderId) {
    super("Order not found: " + orderId);
    this.orderId = orderId;
  }

  public Long getOrderId() {
    return orderId;
  }
}
