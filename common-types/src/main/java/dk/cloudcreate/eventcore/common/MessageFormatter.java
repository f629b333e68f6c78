package dk.cloudcreate.eventcore.common;

import java.util.*;

/**
 * Formats messages using the SLF4J <code>{}</code> placeholder syntax, so exception messages
 * and log statements read the same way.<br>
 * Example: <code>msg("Expected version {}, but current version is {}", 2, 3)</code><br>
 * <br>
 * Also supports named placeholders, which is what the SQL templates use:<br>
 * <code>bind("SELECT * FROM {:tableName}", arg("tableName", "events"))</code>
 */
public final class MessageFormatter {
    private MessageFormatter() {
    }

    /**
     * Replace each <code>{}</code> placeholder in <code>message</code> with the next argument
     *
     * @param message  the message containing zero or more <code>{}</code> placeholders
     * @param messageArguments the arguments
     * @return the formatted message
     */
    public static String msg(String message, Object... messageArguments) {
        return org.slf4j.helpers.MessageFormatter.arrayFormat(message, messageArguments).getMessage();
    }

    /**
     * Replace each <code>{:name}</code> placeholder with the value of the {@link NamedArgumentBinding} that has the same name
     *
     * @param message the message containing zero or more named placeholders
     * @param bindings the named arguments
     * @return the formatted message
     */
    public static String bind(String message, NamedArgumentBinding... bindings) {
        Objects.requireNonNull(message, "No message provided");
        var result = message;
        for (var binding : bindings) {
            result = result.replace("{:" + binding.name + "}", String.valueOf(binding.value));
        }
        return result;
    }

    public static NamedArgumentBinding arg(String name, Object value) {
        return new NamedArgumentBinding(name, value);
    }

    public static final class NamedArgumentBinding {
        public final String name;
        public final Object value;

        public NamedArgumentBinding(String name, Object value) {
            this.name = Objects.requireNonNull(name, "No name provided");
            this.value = value;
        }
    }
}
