package com.teamchat.domain.dto;

import com.teamchat.domain.model.UserRef;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MemberDto {
    private UserRef ref;
    private String displayName;
    private String email;
}
