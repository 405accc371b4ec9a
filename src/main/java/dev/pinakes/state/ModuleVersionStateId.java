package dev.pinakes.state;

import java.io.Serializable;
import java.util.Objects;

/** Composite primary key of {@link ModuleVersionState}. */
public class ModuleVersionStateId implements Serializable {

  private String modulePath;
  private String version;

  protected ModuleVersionStateId() {}

  public ModuleVersionStateId(String modulePath, String version) {
    this.modulePath = modulePath;
    this.version = version;
  }

  public String getModulePath() {
    return modulePath;
  }

  public String getVersion() {
    return version;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ModuleVersionStateId that)) {
      return false;
    }
    return Objects.equals(modulePath, that.modulePath) && Objects.equals(version, that.version);
  }

  @Override
  public int hashCode() {
    return Objects.hash(modulePath, version);
  }
}
