package io.crisisintel.coordination;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CoordinationApplication {

  public static void main(String[] args) {
    SpringApplication.run(CoordinationApplication.class, args);
  }
}
