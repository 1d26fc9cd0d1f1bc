package com.prediction.market.token_ledger.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.prediction.market.token_ledger.dto.EvidenceFile;
import com.prediction.market.token_ledger.dto.EvidenceItem;
import com.prediction.market.token_ledger.dto.EvidenceValidationResult;
import com.prediction.market.token_ledger.dto.MarketCreationRequest;
import com.prediction.market.token_ledger.service.EvidenceValidationService;
import com.prediction.market.token_ledger.service.MarketValidationService;
import com.prediction.market.token_ledger.validation.ValidationResult;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/validation")
@RequiredArgsConstructor
public class ValidationController {

    private final MarketValidationService marketValidationService;
    private final EvidenceValidationService evidenceValidationService;

    @PostMapping("/market")
    public ResponseEntity<ValidationResult> validateMarket(@RequestBody MarketCreationRequest request) {
        return ResponseEntity.ok(marketValidationService.validateMarket(request));
    }

    @PostMapping("/market/{field}")
    public ResponseEntity<ValidationResult> validateMarketField(@PathVariable String field,
            @RequestBody MarketCreationRequest request) {
        return ResponseEntity.ok(marketValidationService.validateField(field, request));
    }

    @PostMapping("/evidence")
    public ResponseEntity<EvidenceValidationResult> validateEvidence(@RequestBody List<EvidenceItem> evidence) {
        return ResponseEntity.ok(evidenceValidationService.validateEvidenceList(evidence));
    }

    @PostMapping("/evidence/file")
    public ResponseEntity<EvidenceValidationResult> validateFile(@RequestBody EvidenceFile file) {
        return ResponseEntity.ok(evidenceValidationService.validateFile(file));
    }
}
