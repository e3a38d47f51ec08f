package com.bsk.recommender;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RecommenderApplication {

  public static void main(String[] args) {
    SpringApplication.run(RecommenderApplication.class, args);
  }
}
