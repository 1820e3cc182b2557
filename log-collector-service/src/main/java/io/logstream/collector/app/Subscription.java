package io.logstream.collector.app;

import io.logstream.collector.domain.SubscriberFilter;

/**
 * A live subscriber as held by the {@link BroadcastHub} registry.
 */
public record Subscription(long id, SubscriberFilter filter, SubscriberChannel channel) {}
