package dev.pinakes.lock;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Module lock settings, bound from {@code pinakes.lock.*}.
 *
 * <ul>
 *   <li>{@code mode} - {@code advisory} (PostgreSQL advisory locks, default) or {@code in-process}
 *       (single-process semaphores)
 *   <li>{@code stripes} - number of semaphores in in-process mode (default 1024)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "pinakes.lock")
public class LockProperties {

  private String mode = "advisory";
  private int stripes = 1024;

  @PostConstruct
  void validate() {
    if (!mode.equals("advisory") && !mode.equals("in-process")) {
      throw new IllegalStateException(
          "pinakes.lock.mode must be 'advisory' or 'in-process', got: " + mode);
    }
    if (stripes < 1) {
      throw new IllegalStateException("pinakes.lock.stripes must be positive, got: " + stripes);
    }
  }

  public String getMode() {
    return mode;
  }

  public void setMode(String mode) {
    this.mode = mode;
  }

  public int getStripes() {
    return stripes;
  }

  public void setStripes(int stripes) {
    this.stripes = stripes;
  }
}
