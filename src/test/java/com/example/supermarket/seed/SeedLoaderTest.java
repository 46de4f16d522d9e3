package com.example.supermarket.seed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.supermarket.IntegrationTestSupport;
import com.example.supermarket.category.DuplicateSlugException;
import com.example.supermarket.order.OrderEntity;
import com.example.supermarket.order.OrderItem;
import com.example.supermarket.order.OrderService;
import com.example.supermarket.order.OrderStatus;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

@DisplayName("SeedLoader")
class SeedLoaderTest extends IntegrationTestSupport {

  @Autowired
  private SeedLoader seedLoader;

  @Autowired
  private OrderService orderService;

  @Test
  @DisplayName("startup seed yields 4 categories, 5 products, 1 order and 2 items")
  void seededCounts() {
    assertThat(count("categories")).isEqualTo(4);
    assertThat(count("products")).isEqualTo(5);
    assertThat(count("orders")).isEqualTo(1);
    assertThat(count("order_items")).isEqualTo(2);
  }

  @Test
  @DisplayName("both seeded items belong to the seeded order")
  void itemsBoundToSeededOrder() {
    long orderId = seededOrderId();

    List<Long> itemOrderIds = jdbc.queryForList("select order_id from order_items", Long.class);

    assertThat(itemOrderIds).containsExactly(orderId, orderId);
  }

  @Test
  @DisplayName("seeded categories carry the fixture names, slugs and icons")
  void seededCategories() {
    List<Map<String, Object>> rows = jdbc.queryForList("select name, slug, icon from categories order by id");

    assertThat(rows).extracting(r -> r.get("slug"))
        .containsExactly("produce", "meat", "dairy", "snacks");
    assertThat(rows).extracting(r -> r.get("name"))
        .containsExactly("Buah & Sayur", "Daging & Protein", "Susu & Produk Dingin", "Snack & Minuman");
    assertThat(rows).extracting(r -> r.get("icon"))
        .containsExactly("apple", "beef", "milk", "snack");
  }

  @Test
  @DisplayName("seeded order matches the example purchase")
  void seededOrder() {
    OrderEntity order = orderService.findWithItems(seededOrderId());

    assertThat(order.getBuyerName()).isEqualTo("Budi");
    assertThat(order.getBuyerEmail()).isEqualTo("budi@example.com");
    assertThat(order.getBuyerAddress()).isEqualTo("Jl. Mawar No. 1, Jakarta");
    assertThat(order.getSubtotal()).isEqualByComparingTo("87000.00");
    assertThat(order.getDiscount()).isEqualByComparingTo("8700.00");
    assertThat(order.getDeliveryFee()).isEqualByComparingTo("15000.00");
    assertThat(order.getTotal()).isEqualByComparingTo("93300.00");
    assertThat(order.getTotal())
        .isEqualByComparingTo(order.getSubtotal().subtract(order.getDiscount()).add(order.getDeliveryFee()));
    assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
    assertThat(order.getCouponCode()).isEqualTo("HEMAT10");

    assertThat(order.getItems()).extracting(OrderItem::getTitle)
        .containsExactly("Apel Fuji 1kg", "Keripik Kentang 100g");
    assertThat(order.getItems()).extracting(OrderItem::getQuantity).containsExactly(1, 2);
    assertThat(order.getItems()).extracting(OrderItem::getProductId)
        .containsExactly("mock-apple", "mock-chips");
    assertThat(order.getItems().get(0).getPrice()).isEqualByComparingTo("35000.00");
    assertThat(order.getItems().get(1).getPrice()).isEqualByComparingTo("12000.00");
  }

  @Test
  @DisplayName("loading into an emptied schema binds the items to the new order id")
  void reloadIntoEmptySchema() {
    jdbc.update("delete from orders");
    jdbc.update("delete from products");
    jdbc.update("delete from categories");

    SeedLoader.SeedResult result = seedLoader.load();

    assertThat(result.categories()).isEqualTo(4);
    assertThat(result.products()).isEqualTo(5);
    assertThat(result.orderItems()).isEqualTo(2);
    assertThat(count("orders")).isEqualTo(1);
    assertThat(jdbc.queryForList("select order_id from order_items", Long.class))
        .containsExactly(result.orderId(), result.orderId());
  }

  @Test
  @DisplayName("loading twice without a reset fails on the slug uniqueness")
  void loadTwiceFails() {
    assertThatThrownBy(seedLoader::load)
        .isInstanceOf(DuplicateSlugException.class)
        .hasMessageContaining("produce");
  }
}
