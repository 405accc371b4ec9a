package dev.pinakes.index;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * A module path that is served under another, canonical path. Packages of an alternative path
 * never appear in search results.
 *
 * <p>Maps to the {@code alternative_module_paths} table managed by Flyway migrations.
 */
@Entity
@Table(name = "alternative_module_paths")
public class AlternativeModulePath {

  @Id
  @Column(name = "alternative", nullable = false)
  private String alternative;

  @Column(name = "canonical", nullable = false)
  private String canonical;

  protected AlternativeModulePath() {
    // JPA requires no-arg constructor
  }

  public AlternativeModulePath(String alternative, String canonical) {
    this.alternative = alternative;
    this.canonical = canonical;
  }

  public String getAlternative() {
    return alternative;
  }

  public String getCanonical() {
    return canonical;
  }

  public void setCanonical(String canonical) {
    this.canonical = canonical;
  }
}
