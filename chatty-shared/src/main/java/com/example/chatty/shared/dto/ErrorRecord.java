package com.example.chatty.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * The one shape every failure takes on its way to a client, over HTTP or inside an
 * event channel frame. Immutable once built.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorRecord {
    OffsetDateTime timestamp;
    int status;
    String kind;
    String error;
    String message;
    String path;
    @Builder.Default
    List<FieldViolation> fields = List.of();
}
