package com.gt.flashstudy.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.flashstudy.serialization.WireCodeSerializer;

@JsonSerialize(using = WireCodeSerializer.class, as = String.class)
public enum CardStatus implements WireCoded {
    New("new"),
    Learning("learning"),
    Mastered("mastered");

    private final String code;

    CardStatus(String code) {
        this.code = code;
    }

    @Override
    public String getCode() {
        return code;
    }

    public static CardStatus fromCode(String code) {
        for (CardStatus cardStatus : values()) {
            if (cardStatus.code.equalsIgnoreCase(code)) {
                return cardStatus;
            }
        }
        throw new IllegalArgumentException("Unknown card status: " + code);
    }
}
