package com.github.salilvnair.funnelengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class StartConversationRequest {

    @NotBlank
    private String funnelId;
    private String scope;
    @NotBlank
    private String targetUserRef;
}
