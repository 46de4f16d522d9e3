package com.example.supermarket.order;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class OrderService {

  private final OrderRepository orderRepository;
  private final OrderItemRepository orderItemRepository;

  /**
   * Stores an order and its lines in one transaction. The generated order id
   * is read back from the saved order and every line is bound to it directly.
   */
  @Transactional
  public OrderEntity place(@NotNull @Valid NewOrder cmd) {
    log.info("🧾 ORDER Placing order buyer={} items={}", cmd.buyerEmail(), cmd.items().size());
    OrderEntity order = new OrderEntity();
    order.setBuyerName(cmd.buyerName());
    order.setBuyerEmail(cmd.buyerEmail());
    order.setBuyerAddress(cmd.buyerAddress());
    order.setSubtotal(cmd.subtotal());
    order.setDiscount(cmd.discount());
    order.setDeliveryFee(cmd.deliveryFee());
    order.setTotal(cmd.total());
    order.setStatus(cmd.status() == null ? OrderStatus.PENDING : cmd.status());
    order.setCouponCode(cmd.couponCode());

    OrderEntity saved = orderRepository.saveAndFlush(order);
    Long orderId = saved.getId();
    log.debug("🧾 ORDER Order row created id={}", orderId);

    for (NewOrderItem item : cmd.items()) {
      saved.getItems().add(saveItem(saved, item));
    }
    log.info("🧾 ORDER Order persisted id={} total={}", orderId, saved.getTotal());
    return saved;
  }

  @Transactional
  public OrderItem addItem(@NotNull Long orderId, @NotNull @Valid NewOrderItem item) {
    OrderEntity order = orderRepository.findById(orderId)
        .orElseThrow(() -> {
          log.warn("🧾 ORDER Item rejected: order not found id={}", orderId);
          return new OrderNotFoundException(orderId);
        });
    OrderItem saved = saveItem(order, item);
    log.info("🧾 ORDER Item added orderId={} itemId={}", orderId, saved.getId());
    return saved;
  }

  /** Any status may replace any other; transition rules live outside this store. */
  @Transactional
  public OrderEntity setStatus(@NotNull Long orderId, @NotNull OrderStatus status) {
    OrderEntity o = orderRepository.findById(orderId)
        .orElseThrow(() -> {
          log.warn("🧾 ORDER Status change failed: order not found id={}", orderId);
          return new OrderNotFoundException(orderId);
        });
    log.info("🧾 ORDER Status id={} {} -> {}", orderId, o.getStatus(), status);
    o.setStatus(status);
    return orderRepository.saveAndFlush(o);
  }

  @Transactional
  public void delete(@NotNull Long orderId) {
    log.info("🧾 ORDER Deleting order id={}", orderId);
    if (orderRepository.deleteOrderById(orderId) == 0) {
      log.warn("🧾 ORDER Delete failed: order not found id={}", orderId);
      throw new OrderNotFoundException(orderId);
    }
  }

  @Transactional(readOnly = true)
  public OrderEntity findWithItems(@NotNull Long orderId) {
    return orderRepository.findByIdWithItems(orderId)
        .orElseThrow(() -> new OrderNotFoundException(orderId));
  }

  @Transactional(readOnly = true)
  public List<OrderItem> findItems(@NotNull Long orderId) {
    return orderItemRepository.findByOrderId(orderId);
  }

  private OrderItem saveItem(OrderEntity order, NewOrderItem item) {
    var oi = new OrderItem();
    oi.setOrder(order);
    oi.setProductId(item.productId());
    oi.setTitle(item.title());
    oi.setPrice(item.price());
    oi.setQuantity(item.quantity());
    oi.setImage(item.image());
    return orderItemRepository.save(oi);
  }
}
