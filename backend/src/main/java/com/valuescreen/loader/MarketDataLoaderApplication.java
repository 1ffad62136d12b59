package com.valuescreen.loader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MarketDataLoaderApplication {

  public static void main(String[] args) {
    SpringApplication.run(MarketDataLoaderApplication.class, args);
  }
}
