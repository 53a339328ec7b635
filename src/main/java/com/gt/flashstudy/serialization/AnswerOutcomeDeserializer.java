package com.gt.flashstudy.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.gt.flashstudy.model.AnswerOutcome;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class AnswerOutcomeDeserializer extends JsonDeserializer<AnswerOutcome> {
    @Override
    public AnswerOutcome deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        String code = jsonParser.getValueAsString();
        try {
            return AnswerOutcome.fromCode(code);
        } catch (IllegalArgumentException ex) {
            return (AnswerOutcome) deserializationContext.handleWeirdStringValue(AnswerOutcome.class, code, ex.getMessage());
        }
    }
}
