package com.example.supermarket.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

  private Seed seed = new Seed();
  private Status status = new Status();

  @Getter @Setter
  public static class Seed {
    private boolean enabled = true;
    /** Drop and recreate the schema before loading. */
    private boolean reset;
  }

  @Getter @Setter
  public static class Status {
    private boolean enabled = true;
    private int maxTables = 10;
  }
}
