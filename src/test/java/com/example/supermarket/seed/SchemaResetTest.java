package com.example.supermarket.seed;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Runs the drop-then-create path for real. Not transactional: Flyway clean and
 * migrate commit on their own connections. The test ends with the fixtures
 * loaded again, so the shared database is left as the other tests expect it.
 */
@SpringBootTest
@DisplayName("SchemaResetter with SeedLoader")
class SchemaResetTest {

  @Autowired
  private SchemaResetter schemaResetter;

  @Autowired
  private SeedLoader seedLoader;

  @Autowired
  private JdbcTemplate jdbc;

  private long count(String table) {
    return jdbc.queryForObject("select count(*) from " + table, Long.class);
  }

  @Test
  @DisplayName("reset then load yields exactly the fixtures, whatever was there before")
  void resetThenLoad() {
    jdbc.update("insert into categories (name, slug, icon) values ('Roti & Kue', 'bakery', 'bread')");
    jdbc.update("insert into products (title, price, category_slug) values ('Roti Tawar', 15000.00, 'bakery')");
    assertThat(count("categories")).isEqualTo(5);

    schemaResetter.reset();
    SeedLoader.SeedResult result = seedLoader.load();

    assertThat(count("categories")).isEqualTo(4);
    assertThat(count("products")).isEqualTo(5);
    assertThat(count("orders")).isEqualTo(1);
    assertThat(count("order_items")).isEqualTo(2);
    assertThat(jdbc.queryForObject("select id from orders", Long.class)).isEqualTo(result.orderId());
    List<Long> itemOrderIds = jdbc.queryForList("select order_id from order_items", Long.class);
    assertThat(itemOrderIds).containsExactly(result.orderId(), result.orderId());
    assertThat(jdbc.queryForList("select slug from categories", String.class))
        .doesNotContain("bakery");
  }
}
