package com.example.supermarket.product;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProductRepository extends JpaRepository<Product, Long> {

  List<Product> findByCategorySlugOrderByIdAsc(String categorySlug);

  // listing queries, newest first, capped at 100 rows
  List<Product> findTop100ByOrderByCreatedAtDescIdDesc();

  List<Product> findTop100ByCategorySlugOrderByCreatedAtDescIdDesc(String categorySlug);

  List<Product> findTop100ByTitleContainingIgnoreCaseOrderByCreatedAtDescIdDesc(String title);

  List<Product> findTop100ByCategorySlugAndTitleContainingIgnoreCaseOrderByCreatedAtDescIdDesc(
      String categorySlug, String title);
}
