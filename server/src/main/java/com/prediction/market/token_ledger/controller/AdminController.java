package com.prediction.market.token_ledger.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.prediction.market.token_ledger.dto.BalanceAuditResult;
import com.prediction.market.token_ledger.dto.BalanceFixResult;
import com.prediction.market.token_ledger.dto.BalanceHealthReport;
import com.prediction.market.token_ledger.dto.BalanceSnapshot;
import com.prediction.market.token_ledger.dto.MarketRollbackReport;
import com.prediction.market.token_ledger.dto.ReconcileRequest;
import com.prediction.market.token_ledger.dto.ReconciliationReport;
import com.prediction.market.token_ledger.dto.RollbackEligibility;
import com.prediction.market.token_ledger.entity.PredictionCommitment;
import com.prediction.market.token_ledger.entity.TokenTransaction;
import com.prediction.market.token_ledger.service.BalanceReconciliationService;
import com.prediction.market.token_ledger.service.CommitmentSettlementService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Operator endpoints: settlement, market rollback and balance reconciliation.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private static final String DEFAULT_REFUND_REASON = "admin_refund";
    private static final String DEFAULT_ROLLBACK_REASON = "market_cancelled";

    private final CommitmentSettlementService settlementService;
    private final BalanceReconciliationService reconciliationService;

    @PostMapping("/commitments/{commitmentId}/win")
    public ResponseEntity<PredictionCommitment> settleWin(@PathVariable String commitmentId) {
        return ResponseEntity.ok(settlementService.settleWin(commitmentId));
    }

    @PostMapping("/commitments/{commitmentId}/loss")
    public ResponseEntity<PredictionCommitment> settleLoss(@PathVariable String commitmentId) {
        return ResponseEntity.ok(settlementService.settleLoss(commitmentId));
    }

    @PostMapping("/commitments/{commitmentId}/refund")
    public ResponseEntity<PredictionCommitment> refund(@PathVariable String commitmentId,
            @RequestParam(defaultValue = DEFAULT_REFUND_REASON) String reason) {
        return ResponseEntity.ok(settlementService.refundCommitment(commitmentId, reason));
    }

    @GetMapping("/commitments/{commitmentId}/rollback-eligibility")
    public ResponseEntity<RollbackEligibility> rollbackEligibility(@PathVariable String commitmentId) {
        return ResponseEntity.ok(settlementService.canRollback(commitmentId));
    }

    @PostMapping("/markets/{marketId}/rollback")
    public ResponseEntity<MarketRollbackReport> rollbackMarket(@PathVariable String marketId,
            @RequestParam(defaultValue = DEFAULT_ROLLBACK_REASON) String reason) {
        log.warn("Rolling back commitments for market {} (reason={})", marketId, reason);
        return ResponseEntity.ok(settlementService.rollbackMarketCommitments(marketId, reason));
    }

    @GetMapping("/balances/{userId}/audit")
    public ResponseEntity<BalanceAuditResult> audit(@PathVariable String userId) {
        return ResponseEntity.ok(reconciliationService.auditUserBalance(userId));
    }

    @GetMapping("/balances/{userId}/snapshot")
    public ResponseEntity<BalanceSnapshot> snapshot(@PathVariable String userId) {
        return ResponseEntity.ok(reconciliationService.createBalanceSnapshot(userId));
    }

    @GetMapping("/balances/{userId}/refunds")
    public ResponseEntity<List<TokenTransaction>> refunds(@PathVariable String userId) {
        return ResponseEntity.ok(settlementService.getRollbackHistory(userId));
    }

    @PostMapping("/balances/{userId}/fix")
    public ResponseEntity<BalanceFixResult> fix(@PathVariable String userId) {
        return ResponseEntity.ok(reconciliationService.fixUserBalance(userId));
    }

    @PostMapping("/balances/reconcile")
    public ResponseEntity<ReconciliationReport> reconcile(@RequestBody @Valid ReconcileRequest request) {
        return ResponseEntity.ok(reconciliationService.reconcileMultipleUsers(request.getUserIds()));
    }

    @PostMapping("/balances/reconcile-all")
    public ResponseEntity<ReconciliationReport> reconcileAll() {
        return ResponseEntity.ok(reconciliationService.reconcileAllUsers());
    }

    @GetMapping("/balances/health")
    public ResponseEntity<BalanceHealthReport> health() {
        return ResponseEntity.ok(reconciliationService.generateHealthReport());
    }
}
