package com.scholary.spatialaudio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpatialAudioApplication {

  public static void main(String[] args) {
    SpringApplication.run(SpatialAudioApplication.class, args);
  }
}
