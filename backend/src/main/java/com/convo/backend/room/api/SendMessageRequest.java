package com.convo.backend.room.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * {@code message} is left untyped so that non-text payloads reach the message validator and are
 * reported as such instead of failing JSON binding.
 */
public record SendMessageRequest(
    @NotBlank @Size(max = 64) @Schema(description = "Display name of the sender.", example = "Alice")
        String username,
    @Schema(description = "Message text.", example = "hi", type = "string") Object message) {}
