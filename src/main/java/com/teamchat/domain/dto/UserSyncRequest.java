package com.teamchat.domain.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class UserSyncRequest {
    @NotBlank(message = "display_name_required")
    @Size(max = 64, message = "display_name_too_long")
    private String displayName;
    @Size(max = 128, message = "email_too_long")
    private String email;
}
