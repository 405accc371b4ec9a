package dev.pinakes.module;

/**
 * The operating system and architecture a package was documented for. {@link #ALL} stands for
 * documentation that is identical on every platform.
 */
public record BuildContext(String os, String arch) {

  public static final BuildContext ALL = new BuildContext("all", "all");

  @Override
  public String toString() {
    return os + "/" + arch;
  }
}
