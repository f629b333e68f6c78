package dk.cloudcreate.eventcore.eventstore.postgresql.serializer.json;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dk.cloudcreate.eventcore.eventstore.postgresql.persistence.EventMetaData;
import dk.cloudcreate.eventcore.eventstore.postgresql.test_data.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.types.*;
import org.junit.jupiter.api.*;

import java.time.*;
import java.util.Optional;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.*;

class JacksonJSONSerializerTest {
    private JacksonJSONSerializer serializer;

    @BeforeEach
    void setup() {
        serializer = new JacksonJSONSerializer();
    }

    @Test
    void serializeEvent_resolves_event_type_and_revision() {
        // Given
        var orderId    = OrderId.random();
        var customerId = CustomerId.random();
        var event      = new OrderEvent.OrderAdded(orderId, customerId, 1001);

        // When
        var eventJSON = serializer.serializeEvent(event);

        // Then
        assertThat((CharSequence) eventJSON.getEventType()).isEqualTo(EventType.of(OrderEvent.OrderAdded.class));
        assertThat(eventJSON.getRevision()).isEqualTo(EventRevision.FIRST);
        assertThat(eventJSON.getJson()).contains("\"orderId\":\"" + orderId + "\"")
                                       .contains("\"orderingCustomerId\":\"" + customerId + "\"")
                                       .contains("\"orderNumber\":1001");
        assertThat((Object) eventJSON.deserialize()).isSameAs(event);
    }

    @Test
    void deserializeEvent_with_the_current_revision_does_not_upcast() {
        // Given
        var customerId = CustomerId.random();
        var json       = serializer.serializeEvent(new CustomerRenamed(customerId, "Jane", "Doe")).getJson();

        // When
        var event = (CustomerRenamed) serializer.deserializeEvent(json, EventType.of(CustomerRenamed.class), EventRevision.of(2));

        // Then
        assertThat((CharSequence) event.customerId).isEqualTo(customerId);
        assertThat(event.firstName).isEqualTo("Jane");
        assertThat(event.lastName).isEqualTo("Doe");
    }

    @Test
    void deserializeEvent_chains_upcasters_from_the_persisted_revision_to_the_current_revision() {
        // Given
        serializer.addEventUpcaster(new RevisionedUpcaster(1, json -> json.put("description", json.remove("text").asText())))
                  .addEventUpcaster(new RevisionedUpcaster(2, json -> json.put("priority", 5)));

        // When
        var fromRevision1 = (RevisionedEvent) serializer.deserializeEvent("{\"text\":\"first\"}", EventType.of(RevisionedEvent.class), EventRevision.FIRST);
        var fromRevision2 = (RevisionedEvent) serializer.deserializeEvent("{\"description\":\"second\"}", EventType.of(RevisionedEvent.class), EventRevision.of(2));

        // Then
        assertThat(fromRevision1.description).isEqualTo("first");
        assertThat(fromRevision1.priority).isEqualTo(5);
        assertThat(fromRevision2.description).isEqualTo("second");
        assertThat(fromRevision2.priority).isEqualTo(5);
    }

    @Test
    void deserializeEvent_fails_when_an_upcaster_in_the_chain_is_missing() {
        // Given
        serializer.addEventUpcaster(new RevisionedUpcaster(2, json -> json.put("priority", 5)));

        // When / Then
        assertThatThrownBy(() -> serializer.deserializeEvent("{\"text\":\"first\"}", EventType.of(RevisionedEvent.class), EventRevision.FIRST))
                .isInstanceOf(JSONDeserializationException.class)
                .hasMessageContaining("Missing upcaster")
                .hasMessageContaining("from revision 1");
    }

    @Test
    void deserializeEvent_fails_for_a_revision_newer_than_the_code() {
        assertThatThrownBy(() -> serializer.deserializeEvent("{}", EventType.of(RevisionedEvent.class), EventRevision.of(4)))
                .isInstanceOf(JSONDeserializationException.class)
                .hasMessageContaining("newer than the current revision 3");
    }

    @Test
    void only_one_upcaster_per_event_type_and_revision_can_be_registered() {
        // Given
        serializer.addEventUpcaster(new RevisionedUpcaster(1, json -> json));

        // When / Then
        assertThatThrownBy(() -> serializer.addEventUpcaster(new RevisionedUpcaster(1, json -> json)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void java_time_and_optional_fields_are_supported() {
        // Given
        var event = new TimedEvent(OffsetDateTime.of(2024, 5, 17, 10, 15, 30, 0, ZoneOffset.UTC), Optional.of("note"));

        // When
        var json         = serializer.serializeEvent(event).getJson();
        var deserialized = serializer.deserialize(json, TimedEvent.class);

        // Then
        assertThat(json).contains("2024-05-17T10:15:30Z").contains("\"note\"");
        assertThat(deserialized.at).isEqualTo(event.at);
        assertThat(deserialized.note).contains("note");
    }

    @Test
    void metadata_round_trip_and_empty_metadata() {
        var json = serializer.serializeMetaData(EventMetaData.of("user", "alice"));

        assertThat(serializer.deserializeMetaData(json)).containsExactly(entry("user", "alice"));
        assertThat(serializer.deserializeMetaData(null)).isEmpty();
        assertThat(serializer.deserializeMetaData("")).isEmpty();
    }

    @Test
    void invalid_json_fails_with_a_deserialization_exception() {
        assertThatThrownBy(() -> serializer.deserialize("{not json", CustomerRenamed.class))
                .isInstanceOf(JSONDeserializationException.class);
    }

    @Revision(3)
    public static class RevisionedEvent {
        public String description;
        public int    priority;

        private RevisionedEvent() {
        }
    }

    public static class TimedEvent {
        public OffsetDateTime   at;
        public Optional<String> note;

        private TimedEvent() {
        }

        public TimedEvent(OffsetDateTime at, Optional<String> note) {
            this.at = at;
            this.note = note;
        }
    }

    private static class RevisionedUpcaster implements EventUpcaster {
        private final int                      fromRevision;
        private final UnaryOperator<ObjectNode> upcast;

        private RevisionedUpcaster(int fromRevision, UnaryOperator<ObjectNode> upcast) {
            this.fromRevision = fromRevision;
            this.upcast = upcast;
        }

        @Override
        public EventType eventType() {
            return EventType.of(RevisionedEvent.class);
        }

        @Override
        public EventRevision fromRevision() {
            return EventRevision.of(fromRevision);
        }

        @Override
        public ObjectNode upcast(ObjectNode eventJson) {
            return upcast.apply(eventJson);
        }
    }
}
