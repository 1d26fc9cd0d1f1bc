package com.prediction.market.token_ledger.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.prediction.market.token_ledger.dto.BalanceView;
import com.prediction.market.token_ledger.dto.PurchaseRequest;
import com.prediction.market.token_ledger.dto.TransactionHistory;
import com.prediction.market.token_ledger.service.TokenLedgerService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Balance reads and token purchases. Reading a balance creates it with the signup bonus
 * on first access.
 */
@RestController
@RequestMapping("/api/balances")
@Validated
@RequiredArgsConstructor
@Slf4j
public class BalanceController {

    private final TokenLedgerService tokenLedgerService;

    @GetMapping("/{userId}")
    public ResponseEntity<BalanceView> getBalance(@PathVariable String userId) {
        return ResponseEntity.ok(tokenLedgerService.getBalanceView(userId));
    }

    @PostMapping("/summary")
    public ResponseEntity<List<BalanceView>> summary(@RequestBody List<String> userIds) {
        return ResponseEntity.ok(tokenLedgerService.getBalanceSummary(userIds).stream()
                .map(TokenLedgerService::toView)
                .toList());
    }

    @GetMapping("/{userId}/transactions")
    public ResponseEntity<TransactionHistory> getTransactions(@PathVariable String userId) {
        return ResponseEntity.ok(tokenLedgerService.getTransactionHistory(userId));
    }

    @PostMapping("/{userId}/purchases")
    public ResponseEntity<BalanceView> purchase(@PathVariable String userId,
            @RequestBody @Valid PurchaseRequest request) {
        log.info("Purchase: userId={}, tokens={}, usd={}", userId, request.getTokens(), request.getUsdAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(TokenLedgerService.toView(
                tokenLedgerService.recordPurchase(userId, request.getTokens(), request.getUsdAmount(),
                        request.getPaymentReference())));
    }
}
