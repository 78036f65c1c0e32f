package dev.regula;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the Regula question-answering service.
 *
 * <p>Runs as a web service by default. The {@code build-index} profile instead embeds a chunk
 * file, writes the index snapshot and exits.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class RegulaApplication {
  public static void main(String[] args) {
    SpringApplication.run(RegulaApplication.class, args);
  }
}
