package com.cinemaregistry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CinemaRegistryScraperApplication {

  public static void main(String[] args) {
    SpringApplication.run(CinemaRegistryScraperApplication.class, args);
  }
}
