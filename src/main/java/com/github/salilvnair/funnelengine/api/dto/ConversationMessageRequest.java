package com.github.salilvnair.funnelengine.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ConversationMessageRequest {

    @NotNull
    private String message;
}
