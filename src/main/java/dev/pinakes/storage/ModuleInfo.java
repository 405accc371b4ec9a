package dev.pinakes.storage;

import dev.pinakes.version.VersionType;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/** A stored {@code modules} row. */
public record ModuleInfo(
    long id,
    String modulePath,
    String version,
    Instant commitTime,
    VersionType versionType,
    String seriesPath,
    boolean incompatible,
    boolean hasGoMod,
    boolean redistributable,
    @Nullable String sourceInfo,
    Instant updatedAt) {}
