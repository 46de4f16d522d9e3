package com.example.supermarket.category;

public class CategoryNotFoundException extends RuntimeException {

  private final String slug;

  public CategoryNotFoundException(String slug) {
    this(slug, null);
  }

  public CategoryNotFoundException(String slug, Throwable cause) {
    super("Category not found: " + slug, cause);
    this.slug = slug;
  }

  public String getSlug() {
    return slug;
  }
}
