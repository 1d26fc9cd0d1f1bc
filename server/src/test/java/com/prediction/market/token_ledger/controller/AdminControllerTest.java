package com.prediction.market.token_ledger.controller;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.prediction.market.token_ledger.dto.RollbackEligibility;
import com.prediction.market.token_ledger.entity.CommitmentStatus;
import com.prediction.market.token_ledger.entity.PredictionCommitment;
import com.prediction.market.token_ledger.exception.BalanceNotFoundException;
import com.prediction.market.token_ledger.exception.CommitmentNotFoundException;
import com.prediction.market.token_ledger.service.BalanceReconciliationService;
import com.prediction.market.token_ledger.service.CommitmentSettlementService;

@WebMvcTest(AdminController.class)
class AdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CommitmentSettlementService settlementService;

    @MockBean
    private BalanceReconciliationService reconciliationService;

    @Test
    void settlingUnknownCommitmentReturns404() throws Exception {
        when(settlementService.settleWin("missing")).thenThrow(new CommitmentNotFoundException("missing"));

        mockMvc.perform(post("/api/admin/commitments/missing/win"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Commitment not found: missing"));
    }

    @Test
    void settlingTwiceReturns409() throws Exception {
        when(settlementService.settleLoss("c1"))
                .thenThrow(new IllegalStateException("Commitment c1 cannot move from WON to LOST"));

        mockMvc.perform(post("/api/admin/commitments/c1/loss"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Invalid State"));
    }

    @Test
    void refundUsesDefaultReason() throws Exception {
        PredictionCommitment refunded = PredictionCommitment.builder()
                .id("c1").userId("u1").predictionId("m1").marketId("m1").optionId("yes")
                .tokensCommitted(50).status(CommitmentStatus.REFUNDED)
                .build();
        when(settlementService.refundCommitment("c1", "admin_refund")).thenReturn(refunded);

        mockMvc.perform(post("/api/admin/commitments/c1/refund"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("c1"));

        verify(settlementService).refundCommitment("c1", "admin_refund");
    }

    @Test
    void rollbackEligibilityCarriesReason() throws Exception {
        when(settlementService.canRollback("c1"))
                .thenReturn(RollbackEligibility.denied("Commitment is too old to rollback", null));

        mockMvc.perform(get("/api/admin/commitments/c1/rollback-eligibility"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.canRollback").value(false))
                .andExpect(jsonPath("$.reason").value("Commitment is too old to rollback"));
    }

    @Test
    void snapshotOfUnknownUserReturns404() throws Exception {
        when(reconciliationService.createBalanceSnapshot("ghost")).thenThrow(new BalanceNotFoundException("ghost"));

        mockMvc.perform(get("/api/admin/balances/ghost/snapshot"))
                .andExpect(status().isNotFound());
    }

    @Test
    void fixingUnknownUserReturns404() throws Exception {
        when(reconciliationService.fixUserBalance("ghost")).thenThrow(new BalanceNotFoundException("ghost"));

        mockMvc.perform(post("/api/admin/balances/ghost/fix"))
                .andExpect(status().isNotFound());
    }

    @Test
    void reconcileRequiresUserIds() throws Exception {
        mockMvc.perform(post("/api/admin/balances/reconcile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));

        verifyNoInteractions(reconciliationService);
    }
}
