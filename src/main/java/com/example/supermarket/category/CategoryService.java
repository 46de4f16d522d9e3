package com.example.supermarket.category;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class CategoryService {

  private final CategoryRepository categoryRepository;

  @Transactional
  public Category create(@NotNull @Valid NewCategory cmd) {
    log.info("🗂️ CATALOG Creating category slug={}", cmd.slug());
    try {
      return categoryRepository.saveAndFlush(new Category(cmd.name(), cmd.slug(), cmd.icon()));
    } catch (DataIntegrityViolationException e) {
      log.warn("🗂️ CATALOG Category rejected: slug taken {}", cmd.slug());
      throw new DuplicateSlugException(cmd.slug(), e);
    }
  }

  @Transactional(readOnly = true)
  public List<Category> findAll() {
    return categoryRepository.findAllByOrderByIdAsc();
  }

  @Transactional(readOnly = true)
  public Category findBySlug(String slug) {
    return categoryRepository.findBySlug(slug)
        .orElseThrow(() -> new CategoryNotFoundException(slug));
  }

  /**
   * Changes a category's slug. Products follow through the foreign key's
   * update cascade, so nothing is rewritten here.
   */
  @Transactional
  public Category renameSlug(@NotBlank String oldSlug, @NotBlank @Size(max = 120) String newSlug) {
    log.info("🗂️ CATALOG Renaming category slug {} -> {}", oldSlug, newSlug);
    if (!categoryRepository.existsBySlug(oldSlug)) {
      log.warn("🗂️ CATALOG Rename failed: category not found {}", oldSlug);
      throw new CategoryNotFoundException(oldSlug);
    }
    if (oldSlug.equals(newSlug)) return findBySlug(oldSlug);
    if (categoryRepository.existsBySlug(newSlug)) {
      log.warn("🗂️ CATALOG Rename rejected: slug taken {}", newSlug);
      throw new DuplicateSlugException(newSlug);
    }
    try {
      categoryRepository.renameSlug(oldSlug, newSlug);
    } catch (DataIntegrityViolationException e) {
      log.warn("🗂️ CATALOG Rename rejected: slug taken {}", newSlug);
      throw new DuplicateSlugException(newSlug, e);
    }
    return findBySlug(newSlug);
  }

  @Transactional
  public void delete(String slug) {
    log.info("🗂️ CATALOG Deleting category slug={}", slug);
    if (!categoryRepository.existsBySlug(slug)) {
      log.warn("🗂️ CATALOG Delete failed: category not found {}", slug);
      throw new CategoryNotFoundException(slug);
    }
    try {
      categoryRepository.deleteBySlug(slug);
    } catch (DataIntegrityViolationException e) {
      log.warn("🗂️ CATALOG Delete rejected: category {} still has products", slug);
      throw new CategoryInUseException(slug, e);
    }
  }
}
