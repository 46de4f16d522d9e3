package com.example.supermarket.seed;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.springframework.stereotype.Component;

/**
 * Drops every object Flyway manages and reapplies the migrations, giving the
 * seed loader an empty schema.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SchemaResetter {

  private final Flyway flyway;

  public void reset() {
    log.warn("🌱 SEED Dropping and recreating schema");
    // the shared bean keeps clean disabled; only this copy may clean
    Flyway cleanable = Flyway.configure()
        .configuration(flyway.getConfiguration())
        .cleanDisabled(false)
        .load();
    cleanable.clean();
    MigrateResult result = cleanable.migrate();
    log.info("🌱 SEED Schema recreated migrations={} version={}",
        result.migrationsExecuted, result.targetSchemaVersion);
  }
}
