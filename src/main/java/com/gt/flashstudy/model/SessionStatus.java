package com.gt.flashstudy.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.flashstudy.serialization.WireCodeSerializer;

@JsonSerialize(using = WireCodeSerializer.class, as = String.class)
public enum SessionStatus implements WireCoded {
    Active("active"),
    Completed("completed"),
    Abandoned("abandoned");

    private final String code;

    SessionStatus(String code) {
        this.code = code;
    }

    @Override
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this != Active;
    }

    public static SessionStatus fromCode(String code) {
        for (SessionStatus sessionStatus : values()) {
            if (sessionStatus.code.equalsIgnoreCase(code)) {
                return sessionStatus;
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + code);
    }
}
