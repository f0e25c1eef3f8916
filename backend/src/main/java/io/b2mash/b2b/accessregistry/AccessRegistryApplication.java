package io.b2mash.b2b.accessregistry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AccessRegistryApplication {

  public static void main(String[] args) {
    SpringApplication.run(AccessRegistryApplication.class, args);
  }
}
