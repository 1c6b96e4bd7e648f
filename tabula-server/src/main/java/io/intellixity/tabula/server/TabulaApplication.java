package io.intellixity.tabula.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class TabulaApplication {
  public static void main(String[] args) {
    SpringApplication.run(TabulaApplication.class, args);
  }
}
