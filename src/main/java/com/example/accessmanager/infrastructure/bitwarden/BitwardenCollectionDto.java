package com.example.accessmanager.infrastructure.bitwarden;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BitwardenCollectionDto {
    private String id;
    private String externalId;
    private List<GroupAccessDto> groups = new ArrayList<>();

    /** Access of one group to the collection. */
    @Getter
    @Setter
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GroupAccessDto {
        private String id;
        private boolean readOnly;
    }
}
