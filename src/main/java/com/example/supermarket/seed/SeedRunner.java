package com.example.supermarket.seed;

import com.example.supermarket.category.CategoryRepository;
import com.example.supermarket.config.AppProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class SeedRunner implements ApplicationRunner {

  private final AppProperties props;
  private final SchemaResetter schemaResetter;
  private final SeedLoader seedLoader;
  private final CategoryRepository categoryRepository;

  @Override
  public void run(ApplicationArguments args) {
    var seed = props.getSeed();
    if (!seed.isEnabled()) {
      log.info("🌱 SEED Disabled, leaving database as is");
      return;
    }
    if (seed.isReset()) {
      schemaResetter.reset();
      seedLoader.load();
      return;
    }
    long existing = categoryRepository.count();
    if (existing > 0) {
      log.info("🌱 SEED Skipped: {} categories already present (set app.seed.reset=true to reload)", existing);
      return;
    }
    seedLoader.load();
  }
}
