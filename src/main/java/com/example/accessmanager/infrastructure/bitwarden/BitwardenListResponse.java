package com.example.accessmanager.infrastructure.bitwarden;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/** List envelope returned by the public API. */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BitwardenListResponse<T> {
    private List<T> data = new ArrayList<>();
    private String continuationToken;
}
