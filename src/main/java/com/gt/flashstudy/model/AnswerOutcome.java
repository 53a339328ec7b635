package com.gt.flashstudy.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.flashstudy.serialization.AnswerOutcomeDeserializer;
import com.gt.flashstudy.serialization.WireCodeSerializer;

@JsonSerialize(using = WireCodeSerializer.class, as = String.class)
@JsonDeserialize(using = AnswerOutcomeDeserializer.class)
public enum AnswerOutcome implements WireCoded {
    Correct("correct"),
    Incorrect("incorrect"),
    Skipped("skipped");

    private final String code;

    AnswerOutcome(String code) {
        this.code = code;
    }

    @Override
    public String getCode() {
        return code;
    }

    public static AnswerOutcome fromCode(String code) {
        for (AnswerOutcome answerOutcome : values()) {
            if (answerOutcome.code.equalsIgnoreCase(code)) {
                return answerOutcome;
            }
        }
        throw new IllegalArgumentException("Unknown answer outcome: " + code);
    }
}
