package dev.pinakes.latest;

/**
 * Result of recomputing a module's good version. Either side is the empty string when the module
 * had, or now has, no good version.
 */
public record GoodVersionChange(String previous, String current) {

  public boolean changed() {
    return !previous.equals(current);
  }

  public boolean hasGoodVersion() {
    return !current.isEmpty();
  }
}
