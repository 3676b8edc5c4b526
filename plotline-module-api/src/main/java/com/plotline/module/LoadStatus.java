package com.plotline.module;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum LoadStatus {
    SUCCESS,
    FAILED;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
