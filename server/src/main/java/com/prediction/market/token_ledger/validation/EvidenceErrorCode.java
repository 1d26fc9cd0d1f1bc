package com.prediction.market.token_ledger.validation;

public enum EvidenceErrorCode {
    CONTENT_EMPTY,
    CONTENT_TOO_LONG,
    INVALID_URL,
    INVALID_FILE_TYPE,
    FILE_TOO_LARGE,
    INVALID_FILENAME,
    FIRESTORE_UNSAFE_FIELD,

    // warnings
    SUSPICIOUS_DOMAIN,
    CONTENT_SANITIZED
}
