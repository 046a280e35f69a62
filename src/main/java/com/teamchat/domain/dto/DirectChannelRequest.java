package com.teamchat.domain.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class DirectChannelRequest {
    @NotBlank(message = "peer_ref_required")
    private String peerRef;
}
