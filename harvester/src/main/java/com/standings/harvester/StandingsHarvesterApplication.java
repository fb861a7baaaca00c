package com.standings.harvester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StandingsHarvesterApplication {

  public static void main(String[] args) {
    SpringApplication.run(StandingsHarvesterApplication.class, args);
  }
}
