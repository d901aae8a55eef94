package com.facilityhub.realtime.model.domain;

public enum Severity {
    INFO,
    SUCCESS,
    WARNING,
    ERROR
}
