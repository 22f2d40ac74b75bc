package com.anomalybench.core.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.std.NumberDeserializers;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;

/**
 * Binds {@code int} and {@code long} parameters, accepting a floating-point
 * value only when it is a whole number ({@code 100.0} binds, {@code 5.7}
 * fails). Everything else is handled by Jackson's own number deserializer.
 *
 * @param <T> boxed integral type
 * @since 1.0.0
 */
final class IntegralNumberDeserializer<T extends Number> extends StdDeserializer<T> {

    private static final long serialVersionUID = 1L;

    private final JsonDeserializer<T> delegate;

    @SuppressWarnings("unchecked")
    private IntegralNumberDeserializer(Class<T> type) {
        super(type);
        this.delegate = (JsonDeserializer<T>) NumberDeserializers.find(type, type.getName());
    }

    /**
     * @return a module registering the strict deserializer for {@code int},
     *         {@code Integer}, {@code long} and {@code Long}
     */
    static SimpleModule module() {
        SimpleModule module = new SimpleModule("integral-numbers");
        module.addDeserializer(int.class, new IntegralNumberDeserializer<>(int.class));
        module.addDeserializer(Integer.class, new IntegralNumberDeserializer<>(Integer.class));
        module.addDeserializer(long.class, new IntegralNumberDeserializer<>(long.class));
        module.addDeserializer(Long.class, new IntegralNumberDeserializer<>(Long.class));
        return module;
    }

    @Override
    @SuppressWarnings("unchecked")
    public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() == JsonToken.VALUE_NUMBER_FLOAT) {
            double value = p.getDoubleValue();
            if (!Double.isFinite(value) || value != Math.rint(value)) {
                return (T) ctxt.handleWeirdNumberValue(handledType(), value, "not an integral value");
            }
        }
        return delegate.deserialize(p, ctxt);
    }

    @Override
    public T getNullValue(DeserializationContext ctxt) throws JsonMappingException {
        return delegate.getNullValue(ctxt);
    }
}
