package com.example.supermarket.order;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "orders")
public class OrderEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "buyer_name", nullable = false, length = 160)
  private String buyerName;

  @Column(name = "buyer_email", nullable = false, length = 160)
  private String buyerEmail;

  @Column(name = "buyer_address", nullable = false, columnDefinition = "TEXT")
  private String buyerAddress;

  @Column(nullable = false, precision = 12, scale = 2)
  private BigDecimal subtotal = BigDecimal.ZERO;

  @Column(nullable = false, precision = 12, scale = 2)
  private BigDecimal discount = BigDecimal.ZERO;

  @Column(name = "delivery_fee", nullable = false, precision = 12, scale = 2)
  private BigDecimal deliveryFee = BigDecimal.ZERO;

  @Column(nullable = false, precision = 12, scale = 2)
  private BigDecimal total = BigDecimal.ZERO;

  @Column(nullable = false)
  private OrderStatus status = OrderStatus.PENDING;

  @Column(name = "coupon_code", length = 64)
  private String couponCode;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  // removal is left to the foreign key's ON DELETE CASCADE
  @ToString.Exclude
  @OneToMany(mappedBy = "order")
  @OrderBy("id ASC")
  private List<OrderItem> items = new ArrayList<>();

  @PrePersist
  void prePersist() {
    if (createdAt == null) createdAt = Instant.now();
    if (updatedAt == null) updatedAt = createdAt;
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
  }
}
