package com.gt.flashstudy.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.flashstudy.serialization.WireCodeSerializer;

@JsonSerialize(using = WireCodeSerializer.class, as = String.class)
public enum CardType implements WireCoded {
    Standard("standard"),
    Quiz("quiz"),
    TypeAnswer("type-answer");

    private final String code;

    CardType(String code) {
        this.code = code;
    }

    @Override
    public String getCode() {
        return code;
    }

    public static CardType fromCode(String code) {
        for (CardType cardType : values()) {
            if (cardType.code.equalsIgnoreCase(code)) {
                return cardType;
            }
        }
        throw new IllegalArgumentException("Unknown card type: " + code);
    }
}
