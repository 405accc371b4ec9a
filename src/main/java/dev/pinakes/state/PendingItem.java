package dev.pinakes.state;

/**
 * A module version handed out by {@link WorkQueueService#nextBatch}.
 *
 * @param modulePath the module path
 * @param version the version to process
 * @param status the status it was recorded with last
 * @param tryCount attempts recorded so far
 * @param numPackages estimated cost, 0 when unknown
 * @param bucket priority bucket, 1 (highest) to 4
 */
public record PendingItem(
    String modulePath,
    String version,
    VersionStatus status,
    int tryCount,
    int numPackages,
    int bucket) {}
