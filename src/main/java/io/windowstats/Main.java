package io.windowstats;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.windowstats.config.ConfigLoader;
import io.windowstats.config.MonitorConfig;
import io.windowstats.event.AsyncEventSink;
import io.windowstats.event.EventHandlers;
import io.windowstats.event.LoggingEventSink;
import io.windowstats.stats.Stat;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

public class Main {
  public static void main(String[] args) throws JsonProcessingException, InterruptedException {
    var json =
        """
        {
          "stats": [
            {
              "name": "request.latency",
              "type": "DOUBLE",
              "aggregations": ["MEAN", "MIN", "MAX", "COUNT"],
              "window": { "type": "FIXED_COUNT", "count": 500 }
            },
            {
              "name": "queue.depth",
              "type": "LONG",
              "aggregations": ["VALUE", "MAX"],
              "window": { "type": "INTERVAL", "duration": "1s" }
            },
            {
              "name": "bytes.sent",
              "type": "LONG",
              "aggregations": ["SUM", "COUNT"],
              "window": { "type": "HYBRID", "duration": "2s", "count": 1000 }
            }
          ]
        }
        """;

    MonitorConfig config = ConfigLoader.fromJson(json);

    EventHandlers handlers = new EventHandlers();
    handlers.register(new LoggingEventSink());

    try (AsyncEventSink sink = new AsyncEventSink(handlers);
        Monitor monitor = Monitor.builder().sink(sink).build()) {
      List<Stat<?>> stats = monitor.createStats(config);
      @SuppressWarnings("unchecked")
      Stat<Double> latency = (Stat<Double>) stats.get(0);
      @SuppressWarnings("unchecked")
      Stat<Long> queueDepth = (Stat<Long>) stats.get(1);
      @SuppressWarnings("unchecked")
      Stat<Long> bytesSent = (Stat<Long>) stats.get(2);

      System.out.println("Recording from 4 threads for ~3 seconds...");
      ExecutorService workers = Executors.newFixedThreadPool(4);
      for (int i = 0; i < 4; i++) {
        workers.submit(
            () -> {
              var random = ThreadLocalRandom.current();
              for (int n = 0; n < 3000; n++) {
                latency.add(5 + random.nextDouble() * 95);
                queueDepth.add((long) random.nextInt(64));
                bytesSent.add((long) random.nextInt(1, 1500));
                try {
                  Thread.sleep(1);
                } catch (InterruptedException e) {
                  Thread.currentThread().interrupt();
                  return;
                }
              }
            });
      }
      workers.shutdown();
      workers.awaitTermination(30, TimeUnit.SECONDS);

      System.out.println("Last closed windows:");
      for (Stat<?> stat : monitor.liveStats()) {
        System.out.println("  - " + stat.getName() + ": " + stat.get());
      }
    }
    System.out.println("Main method completed.");
  }
}
