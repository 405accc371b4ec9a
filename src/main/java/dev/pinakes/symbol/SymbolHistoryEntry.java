package dev.pinakes.symbol;

import dev.pinakes.module.BuildContext;
import dev.pinakes.module.SymbolKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;

/**
 * The earliest release in which an exported symbol of a package was seen, per build context.
 *
 * <p>Maps to the {@code symbol_history} table managed by Flyway migrations.
 */
@Entity
@Table(
    name = "symbol_history",
    uniqueConstraints =
        @UniqueConstraint(
            columnNames = {"package_path", "symbol_name", "parent_name", "build_os", "build_arch"}))
public class SymbolHistoryEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "package_path", nullable = false)
  private String packagePath;

  @Column(name = "module_path", nullable = false)
  private String modulePath;

  @Column(name = "symbol_name", nullable = false)
  private String symbolName;

  @Column(name = "parent_name", nullable = false)
  private String parentName;

  @Column(name = "build_os", nullable = false)
  private String buildOs;

  @Column(name = "build_arch", nullable = false)
  private String buildArch;

  @Enumerated(EnumType.STRING)
  @Column(name = "symbol_kind", nullable = false)
  private SymbolKind symbolKind;

  @Column(name = "since_version", nullable = false)
  private String sinceVersion;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SymbolHistoryEntry() {
    // JPA requires no-arg constructor
  }

  public SymbolHistoryEntry(SymbolKey key, String modulePath, SymbolKind kind, String sinceVersion) {
    this.packagePath = key.packagePath();
    this.symbolName = key.symbolName();
    this.parentName = key.parentName();
    this.buildOs = key.buildContext().os();
    this.buildArch = key.buildContext().arch();
    this.modulePath = modulePath;
    this.symbolKind = kind;
    this.sinceVersion = sinceVersion;
  }

  public SymbolKey key() {
    return new SymbolKey(packagePath, symbolName, parentName, new BuildContext(buildOs, buildArch));
  }

  public Long getId() {
    return id;
  }

  public String getPackagePath() {
    return packagePath;
  }

  public String getModulePath() {
    return modulePath;
  }

  public void setModulePath(String modulePath) {
    this.modulePath = modulePath;
  }

  public String getSymbolName() {
    return symbolName;
  }

  public String getParentName() {
    return parentName;
  }

  public String getBuildOs() {
    return buildOs;
  }

  public String getBuildArch() {
    return buildArch;
  }

  public SymbolKind getSymbolKind() {
    return symbolKind;
  }

  public void setSymbolKind(SymbolKind symbolKind) {
    this.symbolKind = symbolKind;
  }

  public String getSinceVersion() {
    return sinceVersion;
  }

  public void setSinceVersion(String sinceVersion) {
    this.sinceVersion = sinceVersion;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }
}
