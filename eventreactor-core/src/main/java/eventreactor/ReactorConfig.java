package eventreactor;

import eventreactor.spi.EventSink;
import eventreactor.spi.EventSource;
import eventreactor.spi.Tracker;

import java.util.function.Supplier;

/**
 * Default dependencies used by {@link ReactorFactory} for reactors created without
 * explicit ones.
 *
 * <pre>{@code
 * ReactorConfig config = new ReactorConfig()
 *     .setEventSource(store)
 *     .setEventSink(store)
 *     .setTrackerSupplier(() -> new JdbcTracker(connectionProvider));
 * }</pre>
 */
public final class ReactorConfig {
  private EventSource eventSource;
  private EventSink eventSink;
  private Supplier<? extends Tracker> trackerSupplier;

  public EventSource getEventSource() {
    return eventSource;
  }

  public ReactorConfig setEventSource(EventSource eventSource) {
    this.eventSource = eventSource;
    return this;
  }

  public EventSink getEventSink() {
    return eventSink;
  }

  public ReactorConfig setEventSink(EventSink eventSink) {
    this.eventSink = eventSink;
    return this;
  }

  public Supplier<? extends Tracker> getTrackerSupplier() {
    return trackerSupplier;
  }

  /**
   * Sets the supplier for default trackers, typically built on the projections database.
   *
   * @param trackerSupplier creates a tracker for each reactor lacking an explicit one
   * @return this config
   */
  public ReactorConfig setTrackerSupplier(Supplier<? extends Tracker> trackerSupplier) {
    this.trackerSupplier = trackerSupplier;
    return this;
  }

  /**
   * Returns a copy of this config.
   *
   * @return the copy
   */
  public ReactorConfig copy() {
    return new ReactorConfig()
        .setEventSource(eventSource)
        .setEventSink(eventSink)
        .setTrackerSupplier(trackerSupplier);
  }
}
