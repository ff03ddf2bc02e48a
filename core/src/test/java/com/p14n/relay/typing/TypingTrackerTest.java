package com.p14n.relay.typing;

import java.util.List;
import java.util.concurrent.TimeUnit;

import com.p14n.relay.ManualClock;
import com.p14n.relay.data.EventType;
import com.p14n.relay.registry.Broadcaster;
import com.p14n.relay.telemetry.RelayMetrics;

import io.opentelemetry.api.OpenTelemetry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@Timeout(value = 2, unit = TimeUnit.SECONDS)
class TypingTrackerTest {

    private static final String CHANNEL = "general";
    private static final long IDLE = 3000;

    private ManualClock clock;
    private Broadcaster broadcaster;
    private TypingTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(10_000L);
        broadcaster = mock(Broadcaster.class);
        tracker = new TypingTracker(broadcaster, clock, IDLE,
                new RelayMetrics(OpenTelemetry.noop().getMeter("test")));
    }

    @Test
    void shouldBroadcastEveryoneTypingOnStart() {
        tracker.setTyping(CHANNEL, "u1", "One", true);
        clock.advanceMillis(500);
        tracker.setTyping(CHANNEL, "u2", "Two", true);

        var captor = ArgumentCaptor.forClass(Object.class);
        verify(broadcaster, times(2)).broadcast(eq(CHANNEL), eq(EventType.MEMBER_TYPING), captor.capture());
        var update = (TypingUpdate) captor.getAllValues().get(1);
        assertEquals(List.of(new TypingEntry("u1", "One", 10_000L), new TypingEntry("u2", "Two", 10_500L)),
                update.typingUsers());
    }

    @Test
    void shouldRefreshExistingEntry() {
        tracker.setTyping(CHANNEL, "u1", "One", true);
        clock.advanceMillis(2000);
        tracker.setTyping(CHANNEL, "u1", "One", true);
        clock.advanceMillis(2000);

        assertEquals(List.of(new TypingEntry("u1", "One", 12_000L)), tracker.typingUsers(CHANNEL));
        assertEquals(0, tracker.sweep());
    }

    @Test
    void shouldAlwaysBroadcastStopWithRemainingUsers() {
        tracker.setTyping(CHANNEL, "u1", "One", true);
        tracker.setTyping(CHANNEL, "u2", "Two", true);

        tracker.setTyping(CHANNEL, "u1", "One", false);
        tracker.setTyping("quiet", "u3", "Three", false);

        var captor = ArgumentCaptor.forClass(Object.class);
        verify(broadcaster).broadcast(eq(CHANNEL), eq(EventType.MEMBER_STOP_TYPING), captor.capture());
        var stop = (StopTypingUpdate) captor.getValue();
        assertEquals("u1", stop.userId());
        assertEquals(List.of("u2"), stop.remainingTypingUsers().stream().map(TypingEntry::userId).toList());

        verify(broadcaster).broadcast(eq("quiet"), eq(EventType.MEMBER_STOP_TYPING), any());
        assertEquals(1, tracker.channelCount());
    }

    @Test
    void shouldHideExpiredEntriesBeforeSweep() {
        tracker.setTyping(CHANNEL, "u1", "One", true);

        clock.advanceMillis(IDLE);
        assertEquals(1, tracker.typingUsers(CHANNEL).size());

        clock.advanceMillis(1);
        assertTrue(tracker.typingUsers(CHANNEL).isEmpty());
    }

    @Test
    void shouldEvictIdleEntriesOnSweep() {
        tracker.setTyping(CHANNEL, "u1", "One", true);
        clock.advanceMillis(2000);
        tracker.setTyping(CHANNEL, "u2", "Two", true);
        clock.advanceMillis(1500);

        assertEquals(1, tracker.sweep());

        var captor = ArgumentCaptor.forClass(Object.class);
        verify(broadcaster).broadcast(eq(CHANNEL), eq(EventType.MEMBER_STOP_TYPING), captor.capture());
        var stop = (StopTypingUpdate) captor.getValue();
        assertEquals("u1", stop.userId());
        assertEquals("One", stop.displayName());
        assertEquals(List.of(new TypingEntry("u2", "Two", 12_000L)), stop.remainingTypingUsers());

        clock.advanceMillis(2000);
        assertEquals(1, tracker.sweep());
        assertEquals(0, tracker.channelCount());
    }

    @Test
    void shouldOnlyBroadcastClearWhenEntryExisted() {
        assertFalse(tracker.clear(CHANNEL, "u1"));
        verifyNoInteractions(broadcaster);

        tracker.setTyping(CHANNEL, "u1", "One", true);
        assertTrue(tracker.clear(CHANNEL, "u1"));

        verify(broadcaster).broadcast(eq(CHANNEL), eq(EventType.MEMBER_STOP_TYPING),
                eq(new StopTypingUpdate("u1", "One", List.of())));
        assertEquals(0, tracker.channelCount());
        assertFalse(tracker.clear(CHANNEL, "u1"));
        verify(broadcaster, never()).broadcast(eq("other"), any(), any());
    }
}
