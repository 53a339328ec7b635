package com.gt.flashstudy.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.flashstudy.model.WireCoded;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class WireCodeSerializer extends JsonSerializer<WireCoded> {
    @Override
    public void serialize(WireCoded wireCoded, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(wireCoded.getCode());
    }
}
