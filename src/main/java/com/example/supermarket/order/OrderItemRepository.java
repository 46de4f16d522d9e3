package com.example.supermarket.order;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OrderItemRepository extends JpaRepository<OrderItem, Long> {

  @Query("select i from OrderItem i where i.order.id = :orderId order by i.id asc")
  List<OrderItem> findByOrderId(@Param("orderId") Long orderId);
}
