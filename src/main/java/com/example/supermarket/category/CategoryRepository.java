package com.example.supermarket.category;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CategoryRepository extends JpaRepository<Category, Long> {

  Optional<Category> findBySlug(String slug);

  boolean existsBySlug(String slug);

  List<Category> findAllByOrderByIdAsc();

  /**
   * Renames the slug in place. The storage engine cascades the new value into
   * {@code products.category_slug}.
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("update Category c set c.slug = :newSlug where c.slug = :oldSlug")
  int renameSlug(@Param("oldSlug") String oldSlug, @Param("newSlug") String newSlug);

  /**
   * Bulk delete, so the restrict rule of the products foreign key is checked by
   * the storage engine rather than by the persistence context.
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("delete from Category c where c.slug = :slug")
  int deleteBySlug(@Param("slug") String slug);
}
