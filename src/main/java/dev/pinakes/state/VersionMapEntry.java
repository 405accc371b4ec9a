package dev.pinakes.state;

import dev.pinakes.version.SemanticVersion;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * How a requested version (a semantic version, a branch such as {@code master}, or a query such
 * as {@code latest}) resolved for a module.
 *
 * <p>Maps to the {@code version_map} table managed by Flyway migrations.
 */
@Entity
@Table(name = "version_map")
@IdClass(VersionMapEntry.Key.class)
public class VersionMapEntry {

  @Id
  @Column(name = "module_path", nullable = false)
  private String modulePath;

  @Id
  @Column(name = "requested_version", nullable = false)
  private String requestedVersion;

  @Column(name = "resolved_version", nullable = false)
  private String resolvedVersion = "";

  @Column(name = "status", nullable = false)
  private int status;

  @Column(name = "error", nullable = false)
  private String error = "";

  @Column(name = "sort_version", nullable = false)
  private String sortVersion = "";

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected VersionMapEntry() {
    // JPA requires no-arg constructor
  }

  public VersionMapEntry(String modulePath, String requestedVersion) {
    this.modulePath = modulePath;
    this.requestedVersion = requestedVersion;
  }

  public String getModulePath() {
    return modulePath;
  }

  public String getRequestedVersion() {
    return requestedVersion;
  }

  public String getResolvedVersion() {
    return resolvedVersion;
  }

  /** Sets the resolved version and derives its sort key. */
  public void setResolvedVersion(String resolvedVersion) {
    this.resolvedVersion = resolvedVersion == null ? "" : resolvedVersion;
    this.sortVersion =
        this.resolvedVersion.isEmpty() ? "" : SemanticVersion.forSorting(this.resolvedVersion);
  }

  public VersionStatus getStatus() {
    return VersionStatus.fromCode(status);
  }

  public void setStatus(VersionStatus status) {
    this.status = status.code();
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error == null ? "" : error;
  }

  public String getSortVersion() {
    return sortVersion;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }

  /** Composite primary key. */
  public static class Key implements Serializable {

    private String modulePath;
    private String requestedVersion;

    protected Key() {}

    public Key(String modulePath, String requestedVersion) {
      this.modulePath = modulePath;
      this.requestedVersion = requestedVersion;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Key that)) {
        return false;
      }
      return Objects.equals(modulePath, that.modulePath)
          && Objects.equals(requestedVersion, that.requestedVersion);
    }

    @Override
    public int hashCode() {
      return Objects.hash(modulePath, requestedVersion);
    }
  }
}
