package dk.cloudcreate.eventcore.eventstore.postgresql.serializer.json;

import com.fasterxml.jackson.core.*;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import dk.cloudcreate.eventcore.common.types.StringValueType;

import java.io.IOException;
import java.lang.reflect.*;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * Serializes {@link StringValueType} subtypes (e.g. ids used inside events) as plain JSON strings and
 * deserializes them through their single <code>CharSequence</code> (or <code>String</code>) argument constructor
 */
public final class EventCoreTypesJacksonModule extends SimpleModule {
    public EventCoreTypesJacksonModule() {
        super("EventCoreTypesJacksonModule");
        addSerializer(StringValueType.class, ToStringSerializer.instance);
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        context.addDeserializers(new Deserializers.Base() {
            @Override
            public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
                if (StringValueType.class.isAssignableFrom(type.getRawClass()) && !Modifier.isAbstract(type.getRawClass().getModifiers())) {
                    return new StringValueTypeDeserializer(type.getRawClass());
                }
                return null;
            }
        });
    }

    private static final class StringValueTypeDeserializer extends JsonDeserializer<Object> {
        private final Class<?>       valueType;
        private final Constructor<?> constructor;

        private StringValueTypeDeserializer(Class<?> valueType) {
            this.valueType = valueType;
            this.constructor = resolveConstructor(valueType);
        }

        private static Constructor<?> resolveConstructor(Class<?> valueType) {
            for (var parameterType : new Class<?>[]{CharSequence.class, String.class}) {
                try {
                    var constructor = valueType.getDeclaredConstructor(parameterType);
                    constructor.setAccessible(true);
                    return constructor;
                } catch (NoSuchMethodException e) {
                    // Try the next parameter type
                }
            }
            throw new JSONDeserializationException(msg("'{}' doesn't have a constructor taking a single CharSequence or String argument", valueType.getName()));
        }

        @Override
        public Object deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            var value = parser.getValueAsString();
            if (value == null) {
                return context.handleUnexpectedToken(valueType, parser);
            }
            try {
                return constructor.newInstance(value);
            } catch (InvocationTargetException e) {
                throw JsonMappingException.from(parser, msg("Failed to create '{}' from value '{}'", valueType.getName(), value), e.getCause());
            } catch (InstantiationException | IllegalAccessException e) {
                throw JsonMappingException.from(parser, msg("Failed to create '{}' from value '{}'", valueType.getName(), value), e);
            }
        }
    }
}
