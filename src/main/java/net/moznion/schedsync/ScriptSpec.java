package net.moznion.schedsync;

import java.util.OptionalInt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Script payload of a job: {@code {command, timeout_seconds?, ...}}.
 * <p>
 * Kept as a JSON object so that members this library does not know about are passed through
 * untouched and the command member can be missing, explicitly null, or a string.
 */
@EqualsAndHashCode
@ToString
public class ScriptSpec {
    public static final String COMMAND = "command";
    public static final String TIMEOUT_SECONDS = "timeout_seconds";

    private final ObjectNode node;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ScriptSpec(final ObjectNode node) {
        this.node = node.deepCopy();
    }

    public static ScriptSpec of(final String command) {
        final ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(COMMAND, command);
        return new ScriptSpec(node);
    }

    public static ScriptSpec of(final String command, final int timeoutSeconds) {
        final ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(COMMAND, command);
        node.put(TIMEOUT_SECONDS, timeoutSeconds);
        return new ScriptSpec(node);
    }

    public OptionalField<String> getCommand() {
        final JsonNode command = node.get(COMMAND);
        if (command == null) {
            return OptionalField.missing();
        }
        if (command.isNull()) {
            return OptionalField.explicitNull();
        }
        return OptionalField.of(command.isValueNode() ? command.asText() : command.toString());
    }

    public OptionalInt getTimeoutSeconds() {
        final JsonNode timeoutSeconds = node.get(TIMEOUT_SECONDS);
        if (timeoutSeconds == null || !timeoutSeconds.canConvertToInt()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(timeoutSeconds.asInt());
    }

    /**
     * Returns a copy with the command member replaced. A missing command removes the member, an
     * explicit null writes {@code "command": null}. Member order is kept.
     */
    public ScriptSpec withCommand(final OptionalField<String> command) {
        final ObjectNode copy = node.deepCopy();
        if (command.isMissing()) {
            copy.remove(COMMAND);
        } else if (command.isNull()) {
            copy.putNull(COMMAND);
        } else {
            copy.put(COMMAND, command.get());
        }
        return new ScriptSpec(copy);
    }

    @JsonValue
    public ObjectNode toJson() {
        return node.deepCopy();
    }
}
