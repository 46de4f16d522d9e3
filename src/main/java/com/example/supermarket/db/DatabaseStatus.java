package com.example.supermarket.db;

import java.util.List;
import java.util.Map;

public record DatabaseStatus(
    boolean connected,
    String databaseProduct,
    List<String> tables,
    Map<String, Long> rowCounts,
    String error
) {

  static DatabaseStatus failed(String error) {
    return new DatabaseStatus(false, null, List.of(), Map.of(), error);
  }
}
