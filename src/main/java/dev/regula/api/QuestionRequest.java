package dev.regula.api;

import jakarta.validation.constraints.NotNull;

/** Body of {@code POST /chat/answer}. Length and content rules are applied by the guardrail. */
public record QuestionRequest(@NotNull String question) {}
