package dev.pinakes.state;

import dev.pinakes.version.SemanticVersion;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * Durable processing state of one module version.
 *
 * <p>{@code nextProcessedAfter} is when the version becomes due again; {@code lastProcessedAt} is
 * null until the first outcome is recorded. {@code numPackages} estimates processing cost and is
 * null until known.
 *
 * <p>Maps to the {@code module_version_states} table managed by Flyway migrations.
 */
@Entity
@Table(name = "module_version_states")
@IdClass(ModuleVersionStateId.class)
public class ModuleVersionState {

  @Id
  @Column(name = "module_path", nullable = false)
  private String modulePath;

  @Id
  @Column(name = "version", nullable = false)
  private String version;

  @Column(name = "sort_version", nullable = false)
  private String sortVersion;

  @Column(name = "incompatible", nullable = false)
  private boolean incompatible;

  @Column(name = "index_timestamp")
  private Instant indexTimestamp;

  @Column(name = "status", nullable = false)
  private int status;

  @Column(name = "error", nullable = false)
  private String error = "";

  @Column(name = "try_count", nullable = false)
  private int tryCount;

  @Column(name = "last_processed_at")
  private Instant lastProcessedAt;

  @Column(name = "next_processed_after", nullable = false)
  private Instant nextProcessedAfter;

  @Column(name = "app_version", nullable = false)
  private String appVersion = "";

  @Column(name = "go_mod_path", nullable = false)
  private String goModPath = "";

  @Column(name = "num_packages")
  private Integer numPackages;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ModuleVersionState() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates a new, immediately due state.
   *
   * @param modulePath the module path
   * @param version the module version
   * @param now creation time, also the first due time
   */
  public ModuleVersionState(String modulePath, String version, Instant now) {
    this.modulePath = modulePath;
    this.version = version;
    this.sortVersion = SemanticVersion.forSorting(version);
    this.incompatible = SemanticVersion.isIncompatible(version);
    this.status = VersionStatus.NEW.code();
    this.nextProcessedAfter = now;
    this.createdAt = now;
  }

  public String getModulePath() {
    return modulePath;
  }

  public String getVersion() {
    return version;
  }

  public String getSortVersion() {
    return sortVersion;
  }

  public boolean isIncompatible() {
    return incompatible;
  }

  public Instant getIndexTimestamp() {
    return indexTimestamp;
  }

  public void setIndexTimestamp(Instant indexTimestamp) {
    this.indexTimestamp = indexTimestamp;
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

  public int getTryCount() {
    return tryCount;
  }

  public void setTryCount(int tryCount) {
    this.tryCount = tryCount;
  }

  public Instant getLastProcessedAt() {
    return lastProcessedAt;
  }

  public void setLastProcessedAt(Instant lastProcessedAt) {
    this.lastProcessedAt = lastProcessedAt;
  }

  public Instant getNextProcessedAfter() {
    return nextProcessedAfter;
  }

  public void setNextProcessedAfter(Instant nextProcessedAfter) {
    this.nextProcessedAfter = nextProcessedAfter;
  }

  public String getAppVersion() {
    return appVersion;
  }

  public void setAppVersion(String appVersion) {
    this.appVersion = appVersion == null ? "" : appVersion;
  }

  public String getGoModPath() {
    return goModPath;
  }

  public void setGoModPath(String goModPath) {
    this.goModPath = goModPath == null ? "" : goModPath;
  }

  public Integer getNumPackages() {
    return numPackages;
  }

  public void setNumPackages(Integer numPackages) {
    this.numPackages = numPackages;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
