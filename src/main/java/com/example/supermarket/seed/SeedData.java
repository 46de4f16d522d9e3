package com.example.supermarket.seed;

import com.example.supermarket.category.NewCategory;
import com.example.supermarket.order.NewOrder;
import com.example.supermarket.order.NewOrderItem;
import com.example.supermarket.order.OrderStatus;
import com.example.supermarket.product.NewProduct;
import java.math.BigDecimal;
import java.util.List;

/** Fixture rows for development and demo databases. */
public final class SeedData {

  private SeedData() {}

  public static List<NewCategory> categories() {
    return List.of(
        new NewCategory("Buah & Sayur", "produce", "apple"),
        new NewCategory("Daging & Protein", "meat", "beef"),
        new NewCategory("Susu & Produk Dingin", "dairy", "milk"),
        new NewCategory("Snack & Minuman", "snacks", "snack")
    );
  }

  public static List<NewProduct> products() {
    return List.of(
        product("Apel Fuji 1kg", "Apel manis dan segar kualitas premium.", "35000.00", "produce",
            "https://images.unsplash.com/photo-1567306226416-28f0efdc88ce?w=800&q=80&auto=format&fit=crop", "4.7"),
        product("Pisang Cavendish 1kg", "Pisang matang siap makan.", "24000.00", "produce",
            "https://images.unsplash.com/photo-1571772805064-207cd5b3e23d?w=800&q=80&auto=format&fit=crop", "4.5"),
        product("Dada Ayam Fillet 500g", "Daging ayam tanpa tulang.", "42000.00", "meat",
            "https://images.unsplash.com/photo-1550332781-aecd27f7434b?w=800&q=80&auto=format&fit=crop", "4.6"),
        product("Susu UHT 1L", "Susu segar UHT full cream.", "18000.00", "dairy",
            "https://images.unsplash.com/photo-1582719478250-c89cae4dc85b?w=800&q=80&auto=format&fit=crop", "4.4"),
        product("Keripik Kentang 100g", "Snack renyah rasa original.", "12000.00", "snacks",
            "https://images.unsplash.com/photo-1540189549336-e6e99c3679fe?w=800&q=80&auto=format&fit=crop", "4.3")
    );
  }

  public static NewOrder exampleOrder() {
    return new NewOrder(
        "Budi",
        "budi@example.com",
        "Jl. Mawar No. 1, Jakarta",
        new BigDecimal("87000.00"),
        new BigDecimal("8700.00"),
        new BigDecimal("15000.00"),
        new BigDecimal("93300.00"),
        OrderStatus.PENDING,
        "HEMAT10",
        List.of(
            new NewOrderItem("mock-apple", "Apel Fuji 1kg", new BigDecimal("35000.00"), 1, null),
            new NewOrderItem("mock-chips", "Keripik Kentang 100g", new BigDecimal("12000.00"), 2, null)
        )
    );
  }

  private static NewProduct product(String title, String description, String price, String categorySlug,
                                    String image, String rating) {
    return new NewProduct(title, description, new BigDecimal(price), categorySlug, true, image,
        new BigDecimal(rating));
  }
}
