package com.delta.listingtracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeltaListingTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeltaListingTrackerApplication.class, args);
  }
}
