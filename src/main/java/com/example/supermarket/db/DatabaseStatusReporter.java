package com.example.supermarket.db;

import com.example.supermarket.config.AppProperties;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Logs what the connected database looks like once the schema and seed steps
 * have run.
 */
@Component
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class DatabaseStatusReporter implements ApplicationRunner {

  public static final List<String> STOREFRONT_TABLES =
      List.of("categories", "products", "orders", "order_items");

  private final DataSource dataSource;
  private final JdbcTemplate jdbcTemplate;
  private final AppProperties props;

  @Override
  public void run(ApplicationArguments args) {
    if (!props.getStatus().isEnabled()) return;
    DatabaseStatus status = report();
    if (status.connected()) {
      log.info("🗄️ DB Connected product={} tables={} rows={}",
          status.databaseProduct(), status.tables(), status.rowCounts());
    } else {
      log.warn("🗄️ DB Not available: {}", status.error());
    }
  }

  public DatabaseStatus report() {
    int maxTables = Math.max(0, props.getStatus().getMaxTables());
    try (Connection con = dataSource.getConnection()) {
      DatabaseMetaData md = con.getMetaData();
      String product = md.getDatabaseProductName() + " " + md.getDatabaseProductVersion();

      List<String> tables = new ArrayList<>();
      try (ResultSet rs = md.getTables(con.getCatalog(), con.getSchema(), "%", new String[] {"TABLE"})) {
        while (tables.size() < maxTables && rs.next()) {
          tables.add(rs.getString("TABLE_NAME"));
        }
      }

      Map<String, Long> rowCounts = new LinkedHashMap<>();
      for (String table : STOREFRONT_TABLES) {
        rowCounts.put(table, jdbcTemplate.queryForObject("select count(*) from " + table, Long.class));
      }
      return new DatabaseStatus(true, product, List.copyOf(tables), rowCounts, null);
    } catch (SQLException | DataAccessException e) {
      log.warn("🗄️ DB Status check failed", e);
      return DatabaseStatus.failed(e.getMessage());
    }
  }
}
