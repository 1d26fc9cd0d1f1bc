package com.prediction.market.token_ledger.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.prediction.market.token_ledger.dto.BinaryCommitmentRequest;
import com.prediction.market.token_ledger.dto.CommitmentCreationResult;
import com.prediction.market.token_ledger.dto.CommitmentRequest;
import com.prediction.market.token_ledger.dto.MultiOptionCommitmentRequest;
import com.prediction.market.token_ledger.service.CommitmentCreationService;
import com.prediction.market.token_ledger.validation.ValidationResult;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Commitment creation. Failures come back as a {@link CommitmentCreationResult} body; the HTTP
 * status follows the failure code.
 */
@RestController
@RequestMapping("/api/commitments")
@Validated
@RequiredArgsConstructor
@Slf4j
public class CommitmentController {

    private final CommitmentCreationService commitmentCreationService;

    @PostMapping
    public ResponseEntity<CommitmentCreationResult> create(@RequestBody CommitmentRequest request) {
        log.info("Commitment request: userId={}, marketId={}, position={}, optionId={}, tokens={}",
                request.getUserId(), request.resolveMarketId(), request.getPosition(), request.getOptionId(),
                request.getTokensToCommit());
        return toResponse(commitmentCreationService.createCommitment(request));
    }

    @PostMapping("/binary")
    public ResponseEntity<CommitmentCreationResult> createBinary(@RequestBody @Valid BinaryCommitmentRequest request) {
        return toResponse(commitmentCreationService.createBinaryCommitment(request.getUserId(),
                request.getMarketId(), request.getPosition(), request.getTokens(), request.getClientInfo()));
    }

    @PostMapping("/multi-option")
    public ResponseEntity<CommitmentCreationResult> createMultiOption(
            @RequestBody @Valid MultiOptionCommitmentRequest request) {
        return toResponse(commitmentCreationService.createMultiOptionCommitment(request.getUserId(),
                request.getMarketId(), request.getOptionId(), request.getTokens(), request.getClientInfo()));
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidationResult> validate(@RequestBody CommitmentRequest request) {
        return ResponseEntity.ok(commitmentCreationService.validateCommitmentRequest(request));
    }

    static ResponseEntity<CommitmentCreationResult> toResponse(CommitmentCreationResult result) {
        if (result.isSuccess()) {
            return ResponseEntity.status(HttpStatus.CREATED).body(result);
        }
        HttpStatus status = switch (result.getError().getCode()) {
            case CommitmentCreationResult.VALIDATION_FAILED -> HttpStatus.BAD_REQUEST;
            case CommitmentCreationResult.CONCURRENT_MODIFICATION -> HttpStatus.CONFLICT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status).body(result);
    }
}
