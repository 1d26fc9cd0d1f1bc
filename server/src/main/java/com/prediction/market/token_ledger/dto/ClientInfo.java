package com.prediction.market.token_ledger.dto;

import com.prediction.market.token_ledger.entity.CommitmentSource;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClientInfo {
    @Builder.Default
    private CommitmentSource source = CommitmentSource.WEB;
    private String ipAddress;
    private String userAgent;

    public static ClientInfo web() {
        return ClientInfo.builder().build();
    }
}
