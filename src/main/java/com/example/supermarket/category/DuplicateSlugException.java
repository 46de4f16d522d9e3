package com.example.supermarket.category;

public class DuplicateSlugException extends RuntimeException {

  private final String slug;

  public DuplicateSlugException(String slug) {
    this(slug, null);
  }

  public DuplicateSlugException(String slug, Throwable cause) {
    super("Category slug already taken: " + slug, cause);
    this.slug = slug;
  }

  public String getSlug() {
    return slug;
  }
}
