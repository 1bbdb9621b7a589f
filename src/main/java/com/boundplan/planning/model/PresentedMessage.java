package com.boundplan.planning.model;

import org.springframework.lang.Nullable;

public record PresentedMessage(String message, @Nullable String question) {
}
