package eventreactor;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Process-wide default {@link ReactorConfig}, set once during startup.
 *
 * <pre>{@code
 * ReactorDefaults.configure(config -> config
 *     .setEventSource(store)
 *     .setEventSink(store)
 *     .setTrackerSupplier(() -> tracker));
 *
 * Reactor<Map<String, Object>> reactor = ReactorDefaults.factory().create(definition);
 * }</pre>
 *
 * <p>Reactors themselves never read this class; it only feeds {@link ReactorFactory}.
 */
public final class ReactorDefaults {
  private static volatile ReactorConfig config = new ReactorConfig();

  private ReactorDefaults() {
  }

  /**
   * Updates the process-wide config. The callback works on a copy which then replaces
   * the current config.
   *
   * @param configurer mutates the config
   */
  public static synchronized void configure(Consumer<ReactorConfig> configurer) {
    Objects.requireNonNull(configurer, "configurer");
    ReactorConfig updated = config.copy();
    configurer.accept(updated);
    config = updated;
  }

  /**
   * Returns a copy of the current process-wide config.
   *
   * @return the config
   */
  public static ReactorConfig config() {
    return config.copy();
  }

  /**
   * Returns a factory backed by the current process-wide config.
   *
   * @return the factory
   */
  public static ReactorFactory factory() {
    return new ReactorFactory(config);
  }

  /**
   * Clears the process-wide config.
   */
  public static synchronized void reset() {
    config = new ReactorConfig();
  }
}
