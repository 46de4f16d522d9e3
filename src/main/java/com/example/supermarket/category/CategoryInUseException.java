package com.example.supermarket.category;

/** A category cannot be deleted while products still reference its slug. */
public class CategoryInUseException extends RuntimeException {

  private final String slug;

  public CategoryInUseException(String slug, Throwable cause) {
    super("Category still referenced by products: " + slug, cause);
    this.slug = slug;
  }

  public String getSlug() {
    return slug;
  }
}
