package me.golemcore.relay.domain.delivery;

import me.golemcore.relay.domain.model.DeliveredMessage;
import me.golemcore.relay.testsupport.ManualDelayScheduler;
import me.golemcore.relay.testsupport.MutableClock;
import me.golemcore.relay.testsupport.RecordingTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiveMessageTest {

    private static final String THREAD = "thread-1";
    private static final DeliveredMessage PLACEHOLDER = new DeliveredMessage("m0", "r-m0");

    private MutableClock clock;
    private ManualDelayScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        scheduler = new ManualDelayScheduler(clock);
    }

    private EditEmulator emulator(RecordingTransport transport) {
        return new EditEmulator(transport, scheduler, clock, Duration.ofMillis(300), Duration.ofMillis(2000));
    }

    @Test
    void shouldEditNativelyWhenTransportSupportsEdit() {
        RecordingTransport transport = RecordingTransport.withEdit();
        EditEmulator emulator = emulator(transport);
        LiveMessage message = new LiveMessage(transport, emulator, THREAD, PLACEHOLDER);

        message.update("progress 1");
        message.update("progress 2");
        DeliveredMessage last = message.finish("answer").join();

        assertEquals(List.of("progress 1", "progress 2", "answer"), transport.edits());
        assertTrue(transport.posts().isEmpty());
        assertEquals("m0", last.messageId());
        assertFalse(message.isEmulated());
        assertFalse(emulator.hasTrackedMessage(THREAD));
    }

    @Test
    void shouldSkipIdenticalContent() {
        RecordingTransport transport = RecordingTransport.withEdit();
        LiveMessage message = new LiveMessage(transport, emulator(transport), THREAD, PLACEHOLDER);

        message.update("same");
        message.update("same");

        assertEquals(List.of("same"), transport.edits());
    }

    @Test
    void shouldEmulateEditsWhenTransportCannotEdit() {
        RecordingTransport transport = RecordingTransport.withoutEdit();
        EditEmulator emulator = emulator(transport);
        LiveMessage message = new LiveMessage(transport, emulator, THREAD, PLACEHOLDER);

        assertTrue(message.isEmulated());
        assertTrue(emulator.hasTrackedMessage(THREAD));

        message.update("progress");
        assertTrue(transport.posts().isEmpty());

        DeliveredMessage last = message.finish("answer").join();

        assertEquals(List.of("answer"), transport.posts());
        assertEquals(List.of("r-m0"), transport.recalls());
        assertEquals(last, message.current());
        assertEquals("m1", last.messageId());
    }

    @Test
    void shouldSwitchToEmulationWhenNativeEditIsRejected() {
        RecordingTransport transport = RecordingTransport.withEdit();
        transport.setRejectEdits(true);
        EditEmulator emulator = emulator(transport);
        LiveMessage message = new LiveMessage(transport, emulator, THREAD, PLACEHOLDER);

        DeliveredMessage last = message.finish("answer").join();

        assertTrue(message.isEmulated());
        assertEquals(List.of("answer"), transport.posts());
        assertEquals(List.of("r-m0"), transport.recalls());
        assertEquals("m1", last.messageId());
    }
}
