package com.prediction.market.token_ledger.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class MultiOptionCommitmentRequest {
    @NotBlank
    private String userId;
    @NotBlank
    private String marketId;
    @NotBlank
    private String optionId;
    @NotNull
    private Integer tokens;
    private ClientInfo clientInfo;
}
