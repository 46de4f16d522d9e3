package com.example.supermarket;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SupermarketApplication {
  public static void main(String[] args) {
    SpringApplication.run(SupermarketApplication.class, args);
  }
}
