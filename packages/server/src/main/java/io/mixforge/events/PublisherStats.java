package io.mixforge.events;

/** Snapshot of current subscriber registrations. */
public record PublisherStats(int owners, int ownerSubscribers, int broadcastSubscribers) {}
