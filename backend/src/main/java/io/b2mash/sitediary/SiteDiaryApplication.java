package io.b2mash.sitediary;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SiteDiaryApplication {

  public static void main(String[] args) {
    SpringApplication.run(SiteDiaryApplication.class, args);
  }
}
