package com.prediction.market.token_ledger.dto;

import com.prediction.market.token_ledger.entity.Position;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class BinaryCommitmentRequest {
    @NotBlank
    private String userId;
    @NotBlank
    private String marketId;
    @NotNull
    private Position position;
    @NotNull
    private Integer tokens;
    private ClientInfo clientInfo;
}
