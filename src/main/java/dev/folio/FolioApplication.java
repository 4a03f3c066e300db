package dev.folio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the Folio retrieval and ranking engine. */
@SpringBootApplication
public class FolioApplication {
  public static void main(String[] args) {
    SpringApplication.run(FolioApplication.class, args);
  }
}
