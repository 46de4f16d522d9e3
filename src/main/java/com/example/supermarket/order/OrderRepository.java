package com.example.supermarket.order;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OrderRepository extends JpaRepository<OrderEntity, Long> {

  @Query("select distinct o from OrderEntity o left join fetch o.items where o.id = :id")
  Optional<OrderEntity> findByIdWithItems(@Param("id") Long id);

  /** Deleting through SQL lets {@code order_items} go by the foreign key cascade. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("delete from OrderEntity o where o.id = :id")
  int deleteOrderById(@Param("id") Long id);
}
