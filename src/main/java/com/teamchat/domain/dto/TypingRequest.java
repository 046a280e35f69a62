package com.teamchat.domain.dto;

import lombok.Data;

@Data
public class TypingRequest {
    private boolean typing = true;
}
