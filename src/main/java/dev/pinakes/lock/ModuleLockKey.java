package dev.pinakes.lock;

import java.nio.charset.StandardCharsets;

/** Maps a module path to a 64-bit lock key using the FNV-1 hash of its UTF-8 bytes. */
public final class ModuleLockKey {

  private static final long OFFSET_BASIS = 0xcbf29ce484222325L;
  private static final long PRIME = 0x100000001b3L;

  private ModuleLockKey() {}

  public static long of(String modulePath) {
    long hash = OFFSET_BASIS;
    for (byte b : modulePath.getBytes(StandardCharsets.UTF_8)) {
      hash *= PRIME;
      hash ^= (b & 0xff);
    }
    return hash;
  }
}
