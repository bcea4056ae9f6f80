package io.b2mash.imagehost;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ImageHostApplication {

  public static void main(String[] args) {
    SpringApplication.run(ImageHostApplication.class, args);
  }
}
