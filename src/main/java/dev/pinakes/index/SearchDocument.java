package dev.pinakes.index;

import java.time.Instant;
import java.util.List;

/** A row of the search index: one package of a module's good version. */
public record SearchDocument(
    String packagePath,
    String modulePath,
    String version,
    String sortVersion,
    String name,
    String synopsis,
    List<String> licenseTypes,
    boolean redistributable,
    Instant commitTime) {}
