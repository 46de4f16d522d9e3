package com.example.supermarket.seed;

import com.example.supermarket.category.CategoryService;
import com.example.supermarket.order.OrderEntity;
import com.example.supermarket.order.OrderService;
import com.example.supermarket.product.ProductService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Loads {@link SeedData} into an empty schema. Categories go first because
 * products reference their slugs; the example order is stored before its
 * lines, which are bound to the id the order insert returned.
 *
 * <p>Running it against a schema that already holds the fixtures fails on the
 * category slug uniqueness and rolls the whole load back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SeedLoader {

  private final CategoryService categoryService;
  private final ProductService productService;
  private final OrderService orderService;

  @Transactional
  public SeedResult load() {
    log.info("🌱 SEED Loading fixtures");
    var categories = SeedData.categories();
    categories.forEach(categoryService::create);

    var products = SeedData.products();
    products.forEach(productService::create);

    OrderEntity order = orderService.place(SeedData.exampleOrder());

    var result = new SeedResult(categories.size(), products.size(), order.getId(), order.getItems().size());
    log.info("🌱 SEED Done categories={} products={} orderId={} orderItems={}",
        result.categories(), result.products(), result.orderId(), result.orderItems());
    return result;
  }

  public record SeedResult(int categories, int products, Long orderId, int orderItems) {}
}
