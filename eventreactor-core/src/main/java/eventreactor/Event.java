package eventreactor;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable event carrying identity, type, aggregate, payload body and causal metadata.
 *
 * <p>Each event is assigned a time-ordered {@code uuid} derived from a monotonic ULID by
 * default. The sequence {@link #id()} is {@code null} until the event has been appended
 * to a store. The {@link #type()} is always held in canonical form
 * (see {@link EventTypes#canonicalize(String)}).
 *
 * <p>Root events have no causation or correlation id. Events emitted by a reactor carry
 * the uuid of the event being processed as causation id, and inherit its correlation id.
 *
 * @see Emitter
 * @see EventType
 */
public final class Event {

    private final Long id;
    private final UUID uuid;
    private final String type;
    private final String aggregateId;
    private final Map<String, Object> body;
    private final UUID causationId;
    private final UUID correlationId;
    private final Instant createdAt;

    private Event(Builder builder) {
        this.id = builder.id;
        this.uuid = builder.uuid == null ? newUuid() : builder.uuid;
        this.type = EventTypes.canonicalize(Objects.requireNonNull(builder.type, "type"));
        this.aggregateId = builder.aggregateId;
        this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
        this.causationId = builder.causationId;
        this.correlationId = builder.correlationId;

        Map<String, Object> bodyCopy = builder.body == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.body));
        if (bodyCopy.containsKey(null)) {
            throw new IllegalArgumentException("body cannot contain null keys");
        }
        this.body = bodyCopy;
    }

    /**
     * Creates a builder with a type-safe event type.
     *
     * @param type the event type (enum or other EventType implementation)
     * @return a new builder
     */
    public static Builder builder(EventType type) {
        Objects.requireNonNull(type, "type");
        return new Builder(type.name());
    }

    /**
     * Creates a builder with a string event type. The name is canonicalized.
     *
     * @param type the event type name
     * @return a new builder
     */
    public static Builder builder(String type) {
        return new Builder(type);
    }

    /**
     * Creates a root event of the given type for an aggregate.
     *
     * @param type        the event type name
     * @param aggregateId the aggregate identifier, may be {@code null}
     * @param body        the payload body, may be {@code null}
     * @return a new event
     */
    public static Event of(String type, String aggregateId, Map<String, Object> body) {
        return builder(type).aggregateId(aggregateId).body(body).build();
    }

    /**
     * Returns the store-assigned sequence number, or {@code null} if not yet appended.
     *
     * @return the sequence id, or {@code null}
     */
    public Long id() {
        return id;
    }

    public UUID uuid() {
        return uuid;
    }

    public String type() {
        return type;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public Map<String, Object> body() {
        return body;
    }

    public UUID causationId() {
        return causationId;
    }

    public UUID correlationId() {
        return correlationId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * Returns {@code true} if this event has been appended and carries a sequence id.
     *
     * @return whether the event is stored
     */
    public boolean isStored() {
        return id != null;
    }

    /**
     * Returns a builder pre-populated with every field of this event.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder(type)
                .id(id)
                .uuid(uuid)
                .aggregateId(aggregateId)
                .body(body)
                .causationId(causationId)
                .correlationId(correlationId)
                .createdAt(createdAt);
    }

    /**
     * Returns a copy of this event with the given store-assigned sequence id.
     *
     * @param id the sequence id
     * @return the stored copy
     */
    public Event withId(long id) {
        return toBuilder().id(id).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event)) return false;
        Event that = (Event) o;
        return uuid.equals(that.uuid)
                && Objects.equals(id, that.id)
                && type.equals(that.type)
                && Objects.equals(aggregateId, that.aggregateId)
                && body.equals(that.body)
                && Objects.equals(causationId, that.causationId)
                && Objects.equals(correlationId, that.correlationId);
    }

    @Override
    public int hashCode() {
        return uuid.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Event{id=").append(id)
                .append(", uuid=").append(uuid)
                .append(", type=").append(type)
                .append(", aggregateId=").append(aggregateId);
        if (causationId != null) {
            sb.append(", causationId=").append(causationId);
        }
        if (correlationId != null) {
            sb.append(", correlationId=").append(correlationId);
        }
        return sb.append('}').toString();
    }

    /**
     * Builder for {@link Event}.
     */
    public static final class Builder {
        private final String type;
        private Long id;
        private UUID uuid;
        private String aggregateId;
        private Map<String, Object> body;
        private UUID causationId;
        private UUID correlationId;
        private Instant createdAt;

        private Builder(String type) {
            this.type = type;
        }

        /**
         * Sets the store-assigned sequence id. Stores call this on append.
         *
         * @param id the sequence id, or {@code null}
         * @return this builder
         */
        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        /**
         * Sets a custom unique identity.
         *
         * <p>Optional. Defaults to a UUID built from a monotonic ULID.
         *
         * @param uuid the identity
         * @return this builder
         */
        public Builder uuid(UUID uuid) {
            this.uuid = uuid;
            return this;
        }

        /**
         * Sets the originating aggregate identifier.
         *
         * <p>Optional. Defaults to {@code null} for process-level events.
         *
         * @param aggregateId the aggregate identifier
         * @return this builder
         */
        public Builder aggregateId(String aggregateId) {
            this.aggregateId = aggregateId;
            return this;
        }

        /**
         * Sets the payload body. The map is copied at build time.
         *
         * @param body the payload body
         * @return this builder
         */
        public Builder body(Map<String, Object> body) {
            this.body = body;
            return this;
        }

        /**
         * Adds a single entry to the payload body.
         *
         * @param key   the body key
         * @param value the body value
         * @return this builder
         */
        public Builder put(String key, Object value) {
            Objects.requireNonNull(key, "key");
            Map<String, Object> copy = body == null ? new LinkedHashMap<>() : new LinkedHashMap<>(body);
            copy.put(key, value);
            this.body = copy;
            return this;
        }

        public Builder causationId(UUID causationId) {
            this.causationId = causationId;
            return this;
        }

        public Builder correlationId(UUID correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        /**
         * Sets the creation timestamp.
         *
         * <p>Optional. Defaults to {@link Instant#now()}.
         *
         * @param createdAt the creation timestamp
         * @return this builder
         */
        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        /**
         * Builds an immutable {@link Event}.
         *
         * @return a new event
         * @throws NullPointerException     if the type is {@code null}
         * @throws IllegalArgumentException if the type is blank or the body has null keys
         */
        public Event build() {
            return new Event(this);
        }
    }

    private static UUID newUuid() {
        return UlidCreator.getMonotonicUlid().toUuid();
    }
}
