package com.example.accessmanager.infrastructure.bitwarden;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BitwardenMemberDto {
    private String id;
    private String name;
    private String email;
    private int type;
    private boolean accessAll;
}
