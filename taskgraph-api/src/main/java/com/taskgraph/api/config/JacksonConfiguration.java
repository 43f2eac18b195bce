package com.taskgraph.api.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.taskgraph.core.condition.FieldValue;
import com.taskgraph.core.exception.ValidationException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * JSON binding for engine types.
 * Field values serialize through their own JSON form; this adds the reverse direction.
 */
@Configuration
public class JacksonConfiguration {

    @Bean
    public Module fieldValueModule() {
        SimpleModule module = new SimpleModule("taskgraph-field-values");
        module.addDeserializer(FieldValue.class, new FieldValueDeserializer());
        return module;
    }

    static class FieldValueDeserializer extends StdDeserializer<FieldValue> {

        FieldValueDeserializer() {
            super(FieldValue.class);
        }

        @Override
        public FieldValue deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            JsonNode node = parser.getCodec().readTree(parser);
            try {
                return FieldValue.fromJson(node);
            } catch (ValidationException e) {
                throw JsonMappingException.from(parser, e.getMessage(), e);
            }
        }

        @Override
        public FieldValue getNullValue(DeserializationContext context) {
            return FieldValue.EMPTY;
        }
    }
}
