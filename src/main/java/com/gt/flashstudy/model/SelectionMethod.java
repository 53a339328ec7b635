package com.gt.flashstudy.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.flashstudy.serialization.SelectionMethodDeserializer;
import com.gt.flashstudy.serialization.WireCodeSerializer;

@JsonSerialize(using = WireCodeSerializer.class, as = String.class)
@JsonDeserialize(using = SelectionMethodDeserializer.class)
public enum SelectionMethod implements WireCoded {
    Random("random"),
    Smart("smart"),
    Manual("manual"),
    All("all");

    private final String code;

    SelectionMethod(String code) {
        this.code = code;
    }

    @Override
    public String getCode() {
        return code;
    }

    public static SelectionMethod fromCode(String code) {
        for (SelectionMethod selectionMethod : values()) {
            if (selectionMethod.code.equalsIgnoreCase(code)) {
                return selectionMethod;
            }
        }
        throw new IllegalArgumentException("Unknown selection method: " + code);
    }
}
