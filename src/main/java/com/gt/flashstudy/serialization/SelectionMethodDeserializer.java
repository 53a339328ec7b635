package com.gt.flashstudy.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.gt.flashstudy.model.SelectionMethod;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class SelectionMethodDeserializer extends JsonDeserializer<SelectionMethod> {
    @Override
    public SelectionMethod deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        String code = jsonParser.getValueAsString();
        try {
            return SelectionMethod.fromCode(code);
        } catch (IllegalArgumentException ex) {
            return (SelectionMethod) deserializationContext.handleWeirdStringValue(SelectionMethod.class, code, ex.getMessage());
        }
    }
}
