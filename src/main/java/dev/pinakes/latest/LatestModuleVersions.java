package dev.pinakes.latest;

import dev.pinakes.version.Retraction;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The per-module pointer row: upstream facts (raw and cooked latest versions, retractions,
 * deprecation) and the locally computed good version.
 *
 * <p>{@code goodVersion} is the empty string when no stored version qualifies. {@code rowVersion}
 * is incremented every time the good version changes. {@code status} is the outcome of the last
 * upstream lookup; facts are only trusted when it is 200.
 *
 * <p>Maps to the {@code latest_module_versions} table managed by Flyway migrations.
 */
@Entity
@Table(name = "latest_module_versions")
public class LatestModuleVersions {

  /** Status of a row whose upstream facts were fetched successfully. */
  public static final int STATUS_OK = 200;

  @Id
  @Column(name = "module_path", nullable = false)
  private String modulePath;

  @Column(name = "raw_version", nullable = false)
  private String rawVersion = "";

  @Column(name = "cooked_version", nullable = false)
  private String cookedVersion = "";

  @Column(name = "good_version", nullable = false)
  private String goodVersion = "";

  @Convert(converter = RetractionListConverter.class)
  @Column(name = "retractions", nullable = false)
  private List<Retraction> retractions = new ArrayList<>();

  @Column(name = "deprecated", nullable = false)
  private boolean deprecated;

  @Column(name = "deprecation_comment")
  private String deprecationComment;

  @Column(name = "status", nullable = false)
  private int status;

  @Column(name = "row_version", nullable = false)
  private long rowVersion;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected LatestModuleVersions() {
    // JPA requires no-arg constructor
  }

  public LatestModuleVersions(String modulePath, Instant updatedAt) {
    this.modulePath = modulePath;
    this.updatedAt = updatedAt;
  }

  /** Whether the upstream facts of this row can be used for resolution. */
  public boolean hasUpstreamFacts() {
    return status == STATUS_OK;
  }

  public String getModulePath() {
    return modulePath;
  }

  public String getRawVersion() {
    return rawVersion;
  }

  public void setRawVersion(String rawVersion) {
    this.rawVersion = rawVersion;
  }

  public String getCookedVersion() {
    return cookedVersion;
  }

  public void setCookedVersion(String cookedVersion) {
    this.cookedVersion = cookedVersion;
  }

  public String getGoodVersion() {
    return goodVersion;
  }

  public List<Retraction> getRetractions() {
    return retractions;
  }

  public void setRetractions(List<Retraction> retractions) {
    this.retractions = new ArrayList<>(retractions);
  }

  public boolean isDeprecated() {
    return deprecated;
  }

  public void setDeprecated(boolean deprecated) {
    this.deprecated = deprecated;
  }

  public String getDeprecationComment() {
    return deprecationComment;
  }

  public void setDeprecationComment(String deprecationComment) {
    this.deprecationComment = deprecationComment;
  }

  public int getStatus() {
    return status;
  }

  public void setStatus(int status) {
    this.status = status;
  }

  public long getRowVersion() {
    return rowVersion;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }
}
