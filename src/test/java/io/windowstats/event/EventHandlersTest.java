package io.windowstats.event;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EventHandlersTest {

  private EventHandlers handlers;
  private Event event;

  @Mock private EventSink first;
  @Mock private EventSink second;

  @BeforeEach
  void setUp() {
    handlers = new EventHandlers();
    event =
        Event.builder()
            .type("windowstats.Stat")
            .message("latency")
            .timestamp(Instant.parse("2026-01-01T00:00:00Z"))
            .metadata(Map.of("latency.count", 3L))
            .build();
  }

  @Test
  void emit_withRegisteredHandlers_shouldDeliverToAllInOrder() {
    handlers.register(first);
    handlers.register(second);

    handlers.emit(event);

    InOrder inOrder = inOrder(first, second);
    inOrder.verify(first).emit(event);
    inOrder.verify(second).emit(event);
  }

  @Test
  void emit_withoutHandlers_shouldDoNothing() {
    assertDoesNotThrow(() -> handlers.emit(event));
    assertEquals(0, handlers.size());
  }

  @Test
  void register_sameHandlerTwice_shouldKeepOneRegistration() {
    assertTrue(handlers.register(first));
    assertFalse(handlers.register(first));

    handlers.emit(event);

    verify(first, times(1)).emit(event);
    assertEquals(1, handlers.size());
  }

  @Test
  void unregister_shouldStopDelivery() {
    handlers.register(first);
    handlers.register(second);

    assertTrue(handlers.unregister(first));
    assertFalse(handlers.unregister(first));
    handlers.emit(event);

    verifyNoInteractions(first);
    verify(second).emit(event);
  }

  @Test
  void emit_whenHandlerThrows_shouldStillDeliverToOthers() {
    doThrow(new IllegalStateException("sink down")).when(first).emit(event);
    handlers.register(first);
    handlers.register(second);

    assertDoesNotThrow(() -> handlers.emit(event));

    verify(second).emit(event);
  }

  @Test
  void register_null_shouldThrow() {
    assertThrows(NullPointerException.class, () -> handlers.register(null));
  }
}
