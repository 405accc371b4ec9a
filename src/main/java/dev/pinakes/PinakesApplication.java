package dev.pinakes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for Pinakes.
 *
 * <p>The processing worker and the retention sweep are off by default and enabled with {@code
 * pinakes.worker.enabled} and {@code pinakes.retention.enabled}.
 */
@SpringBootApplication
@EnableScheduling
public class PinakesApplication {
  public static void main(String[] args) {
    SpringApplication.run(PinakesApplication.class, args);
  }
}
