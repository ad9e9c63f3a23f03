package im.arun.contenttree.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Structured payload attached to a node, keyed by {@code schemaType}.
 * Consumers dispatch through {@link Visitor} so adding a variant breaks every
 * consumer that does not handle it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "schemaType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EventSchema.class, name = "event"),
    @JsonSubTypes.Type(value = DiningSchema.class, name = "dining"),
    @JsonSubTypes.Type(value = RoomSchema.class, name = "room")
})
public sealed interface SchemaData permits EventSchema, DiningSchema, RoomSchema {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitEvent(EventSchema event);

        R visitDining(DiningSchema dining);

        R visitRoom(RoomSchema room);
    }
}
