package com.example.chatty.gateway.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishRequest {
    @NotBlank(message = "Event name is required")
    @Size(max = 128, message = "Event name must be at most 128 characters")
    private String event;

    private JsonNode payload;
}
