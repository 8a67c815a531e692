package com.example.accessmanager.infrastructure.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GithubTeamDto {
    private long id;
    private String name;
    private String slug;
    private String description;
    private GithubTeamDto parent;
}
