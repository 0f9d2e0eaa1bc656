package com.folautech.metric.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_VALUE("INVALID_VALUE"),
    MISSING_READING("MISSING_READING"),
    REGISTRY_INTEGRITY("REGISTRY_INTEGRITY");

    private final String code;
}
