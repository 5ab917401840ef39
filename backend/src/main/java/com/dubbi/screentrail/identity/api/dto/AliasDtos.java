package com.dubbi.screentrail.identity.api.dto;

import com.dubbi.screentrail.identity.service.AliasSource;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

public final class AliasDtos {
    private AliasDtos() {}

    public record CandidateDTO(
            String identityId,
            String displayName,
            String matchedPhrase,
            double score,
            boolean exact,
            AliasSource source
    ) {}

    public record ResolveResponse(String phrase, List<CandidateDTO> candidates) {}

    public record AddAliasRequest(
            @NotBlank @Size(max = 200) String phrase,
            @NotBlank String identityId
    ) {}

    public record AliasDTO(String phrase, String identityId, String appId, AliasSource source) {}
}
