package dev.pinakes.state;

import java.time.Instant;

/** A module version announced by the upstream index, with the time it was published there. */
public record IndexVersion(String modulePath, String version, Instant timestamp) {}
