package dev.pinakes.ingestion;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Ingestion settings, bound from {@code pinakes.ingestion.*}.
 *
 * <p>{@code bypass-license-check} stores readmes, documentation and license texts even for
 * content that is not redistributable. Intended for private deployments only.
 */
@Configuration
@ConfigurationProperties(prefix = "pinakes.ingestion")
public class IngestionProperties {

  private boolean bypassLicenseCheck = false;

  public boolean isBypassLicenseCheck() {
    return bypassLicenseCheck;
  }

  public void setBypassLicenseCheck(boolean bypassLicenseCheck) {
    this.bypassLicenseCheck = bypassLicenseCheck;
  }
}
