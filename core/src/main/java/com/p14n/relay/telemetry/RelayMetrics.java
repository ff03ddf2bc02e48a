package com.p14n.relay.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for channel fan-out.
 *
 * <p>
 * Instruments, all tagged with the channel name:
 * </p>
 * <ul>
 * <li>broadcasts_published: broadcasts that found an existing channel</li>
 * <li>frames_delivered: frames accepted by a subscriber connection</li>
 * <li>frames_skipped: frames not delivered because the connection was not open,
 * refused the frame or failed</li>
 * <li>active_subscriptions: current subscriptions</li>
 * <li>typing_evictions: typing indicators removed by the idle sweep</li>
 * </ul>
 */
public class RelayMetrics {
        private static final AttributeKey<String> CHANNEL = AttributeKey.stringKey("channel");

        private final LongCounter publishedBroadcasts;
        private final LongCounter deliveredFrames;
        private final LongCounter skippedFrames;
        private final LongUpDownCounter activeSubscriptions;
        private final LongCounter typingEvictions;

        /**
         * Creates the metric instruments on the provided meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public RelayMetrics(Meter meter) {
                publishedBroadcasts = meter.counterBuilder("broadcasts_published")
                                .setDescription("Number of broadcasts sent to an existing channel")
                                .build();

                deliveredFrames = meter.counterBuilder("frames_delivered")
                                .setDescription("Number of frames accepted by subscriber connections")
                                .build();

                skippedFrames = meter.counterBuilder("frames_skipped")
                                .setDescription("Number of frames not delivered to a subscriber")
                                .build();

                activeSubscriptions = meter.upDownCounterBuilder("active_subscriptions")
                                .setDescription("Number of active channel subscriptions")
                                .build();

                typingEvictions = meter.counterBuilder("typing_evictions")
                                .setDescription("Number of typing indicators expired by the sweep")
                                .build();
        }

        public void recordBroadcast(String channel, int delivered, int skipped) {
                var attributes = Attributes.of(CHANNEL, channel);
                publishedBroadcasts.add(1, attributes);
                if (delivered > 0) {
                        deliveredFrames.add(delivered, attributes);
                }
                if (skipped > 0) {
                        skippedFrames.add(skipped, attributes);
                }
        }

        public void recordSubscriptionAdded(String channel) {
                activeSubscriptions.add(1, Attributes.of(CHANNEL, channel));
        }

        public void recordSubscriptionsRemoved(String channel, int count) {
                if (count > 0) {
                        activeSubscriptions.add(-count, Attributes.of(CHANNEL, channel));
                }
        }

        public void recordTypingEviction(String channel) {
                typingEvictions.add(1, Attributes.of(CHANNEL, channel));
        }
}
