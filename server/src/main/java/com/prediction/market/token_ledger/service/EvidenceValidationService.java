package com.prediction.market.token_ledger.service;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.prediction.market.token_ledger.dto.EvidenceFile;
import com.prediction.market.token_ledger.dto.EvidenceItem;
import com.prediction.market.token_ledger.dto.EvidenceValidationResult;
import com.prediction.market.token_ledger.validation.EvidenceErrorCode;
import com.prediction.market.token_ledger.validation.ValidationError;
import com.prediction.market.token_ledger.validation.ValidationWarning;

import lombok.extern.slf4j.Slf4j;

/**
 * Validation and sanitisation of resolution evidence before it is stored.
 */
@Slf4j
@Service
public class EvidenceValidationService {

    public static final int MAX_URL_LENGTH = 2048;
    public static final int MAX_CONTENT_LENGTH = 2000;
    public static final int MAX_DESCRIPTION_LENGTH = 500;
    public static final int MAX_FILENAME_LENGTH = 255;
    public static final long MAX_FILE_SIZE = 10L * 1024 * 1024;
    public static final int MAX_FIELD_NAME_BYTES = 1500;
    public static final Set<String> ALLOWED_FILE_TYPES = Set.of(
            "image/jpeg", "image/png", "image/gif", "image/webp", "application/pdf", "text/plain");

    private static final Set<String> SHORTENER_DOMAINS = Set.of("bit.ly", "tinyurl.com", "goo.gl");

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B-\\u200D\\u2060\\uFEFF]");
    private static final Pattern PRIVATE_USE = Pattern.compile("[\\uE000-\\uF8FF]");
    private static final Pattern FILENAME_UNSAFE = Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x1F]");
    private static final Pattern FIELD_NAME_UNSAFE = Pattern.compile("[~*/\\[\\]]");

    /**
     * Validate one evidence item and produce its sanitised content.
     */
    public EvidenceValidationResult validateEvidence(EvidenceItem evidence) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        if (evidence.getType() == null) {
            errors.add(ValidationError.of("type", EvidenceErrorCode.CONTENT_EMPTY, "Evidence type is required"));
        }
        String content = evidence.getContent();
        if (content == null || content.trim().isEmpty()) {
            errors.add(ValidationError.of("content", EvidenceErrorCode.CONTENT_EMPTY, "Evidence content cannot be empty"));
        }

        String sanitized = content;
        if (content != null && !content.trim().isEmpty() && evidence.getType() != null) {
            sanitized = switch (evidence.getType()) {
                case URL -> validateUrl(content, errors, warnings);
                case DESCRIPTION -> validateText(content, "content", MAX_CONTENT_LENGTH, errors, warnings);
                case SCREENSHOT -> sanitizeContent(content);
            };
        }

        if (evidence.getDescription() != null && !evidence.getDescription().isEmpty()) {
            validateText(evidence.getDescription(), "description", MAX_DESCRIPTION_LENGTH, errors, new ArrayList<>());
        }

        return new EvidenceValidationResult(errors, warnings, sanitized);
    }

    /**
     * Validate several items; fields are prefixed with the item index, e.g. {@code evidence[1].content}.
     */
    public EvidenceValidationResult validateEvidenceList(List<EvidenceItem> evidenceList) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        for (int i = 0; i < evidenceList.size(); i++) {
            String prefix = "evidence[" + i + "].";
            EvidenceValidationResult result = validateEvidence(evidenceList.get(i));
            for (ValidationError e : result.getErrors()) {
                errors.add(new ValidationError(prefix + e.getField(), e.getCode(), e.getMessage()));
            }
            for (ValidationWarning w : result.getWarnings()) {
                warnings.add(new ValidationWarning(prefix + w.getField(), w.getCode(), w.getMessage()));
            }
        }
        return new EvidenceValidationResult(errors, warnings, null);
    }

    /**
     * Validate an uploaded file's metadata. The sanitised filename is returned as content.
     */
    public EvidenceValidationResult validateFile(EvidenceFile file) {
        List<ValidationError> errors = new ArrayList<>();

        if (file.getSize() > MAX_FILE_SIZE) {
            errors.add(ValidationError.of("file", EvidenceErrorCode.FILE_TOO_LARGE,
                    String.format("File too large. Maximum size is %dMB", MAX_FILE_SIZE / 1024 / 1024)));
        }
        String mimeType = file.getMimeType() == null ? "" : file.getMimeType().toLowerCase(Locale.ROOT);
        if (!ALLOWED_FILE_TYPES.contains(mimeType)) {
            errors.add(ValidationError.of("file", EvidenceErrorCode.INVALID_FILE_TYPE,
                    "File type not allowed. Allowed types: " + String.join(", ", ALLOWED_FILE_TYPES.stream().sorted().toList())));
        }

        String name = file.getName() == null ? "" : file.getName();
        if (name.isBlank()) {
            errors.add(ValidationError.of("filename", EvidenceErrorCode.INVALID_FILENAME, "Filename is required"));
        }
        if (name.length() > MAX_FILENAME_LENGTH) {
            errors.add(ValidationError.of("filename", EvidenceErrorCode.INVALID_FILENAME,
                    String.format("Filename too long. Maximum %d characters allowed", MAX_FILENAME_LENGTH)));
        }
        if (FILENAME_UNSAFE.matcher(name).find() || name.contains("..")) {
            errors.add(ValidationError.of("filename", EvidenceErrorCode.INVALID_FILENAME,
                    "Filename contains invalid characters"));
        }

        return new EvidenceValidationResult(errors, List.of(), sanitizeFilename(name));
    }

    /**
     * Check that a name is usable as a document field name.
     */
    public List<ValidationError> validateFieldName(String fieldName) {
        List<ValidationError> errors = new ArrayList<>();
        if (FIELD_NAME_UNSAFE.matcher(fieldName).find()) {
            errors.add(ValidationError.of("fieldName", EvidenceErrorCode.FIRESTORE_UNSAFE_FIELD,
                    "Field name contains invalid characters (~*/[])"));
        }
        if (fieldName.startsWith("__")) {
            errors.add(ValidationError.of("fieldName", EvidenceErrorCode.FIRESTORE_UNSAFE_FIELD,
                    "Field name cannot start with \"__\""));
        }
        if (fieldName.getBytes(StandardCharsets.UTF_8).length > MAX_FIELD_NAME_BYTES) {
            errors.add(ValidationError.of("fieldName", EvidenceErrorCode.FIRESTORE_UNSAFE_FIELD,
                    String.format("Field name too long. Maximum %d bytes allowed", MAX_FIELD_NAME_BYTES)));
        }
        return errors;
    }

    /**
     * Strip control (except newline and tab), zero-width, private-use and unpaired surrogate
     * characters, normalise to NFC and trim.
     */
    public static String sanitizeContent(String content) {
        if (content == null || content.isEmpty()) {
            return content;
        }
        String sanitized = CONTROL_CHARS.matcher(content).replaceAll("");
        sanitized = ZERO_WIDTH.matcher(sanitized).replaceAll("");
        sanitized = PRIVATE_USE.matcher(sanitized).replaceAll("");
        sanitized = removeUnpairedSurrogates(sanitized);
        sanitized = Normalizer.normalize(sanitized, Normalizer.Form.NFC);
        return sanitized.trim();
    }

    public static String sanitizeFilename(String filename) {
        return FILENAME_UNSAFE.matcher(filename).replaceAll("_")
                .replaceAll("\\.+", ".")
                .replaceFirst("^\\.", "_")
                .trim();
    }

    private String validateUrl(String url, List<ValidationError> errors, List<ValidationWarning> warnings) {
        if (url.length() > MAX_URL_LENGTH) {
            errors.add(ValidationError.of("content", EvidenceErrorCode.CONTENT_TOO_LONG,
                    String.format("URL too long. Maximum %d characters allowed", MAX_URL_LENGTH)));
        }
        String sanitized = sanitizeContent(url);
        try {
            URI uri = new URI(sanitized);
            String scheme = uri.getScheme();
            if (scheme == null) {
                errors.add(ValidationError.of("content", EvidenceErrorCode.INVALID_URL, "Invalid URL format"));
                return sanitized;
            }
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                errors.add(ValidationError.of("content", EvidenceErrorCode.INVALID_URL,
                        "URL must use HTTP or HTTPS protocol"));
                return sanitized;
            }
            String host = uri.getHost();
            if (host == null || host.isEmpty()) {
                errors.add(ValidationError.of("content", EvidenceErrorCode.INVALID_URL, "Invalid URL format"));
                return sanitized;
            }
            if (uri.getUserInfo() != null) {
                errors.add(ValidationError.of("content", EvidenceErrorCode.INVALID_URL,
                        "URL must not contain credentials"));
            }
            String lowerHost = host.toLowerCase(Locale.ROOT);
            if (SHORTENER_DOMAINS.stream().anyMatch(d -> lowerHost.equals(d) || lowerHost.endsWith("." + d))) {
                warnings.add(ValidationWarning.of("content", EvidenceErrorCode.SUSPICIOUS_DOMAIN,
                        "Shortened URLs may not be reliable evidence sources"));
            }
        } catch (URISyntaxException e) {
            log.debug("Rejected evidence URL: {}", e.getMessage());
            errors.add(ValidationError.of("content", EvidenceErrorCode.INVALID_URL, "Invalid URL format"));
        }
        return sanitized;
    }

    private String validateText(String text, String field, int maxLength,
            List<ValidationError> errors, List<ValidationWarning> warnings) {
        if (text.length() > maxLength) {
            errors.add(ValidationError.of(field, EvidenceErrorCode.CONTENT_TOO_LONG,
                    String.format("%s too long. Maximum %d characters allowed",
                            "description".equals(field) ? "Description" : "Content", maxLength)));
        }
        String sanitized = sanitizeContent(text);
        if (sanitized.length() < text.length() * 0.8) {
            warnings.add(ValidationWarning.of(field, EvidenceErrorCode.CONTENT_SANITIZED,
                    "Content contained characters that were removed during sanitization"));
        }
        return sanitized;
    }

    private static String removeUnpairedSurrogates(String value) {
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < value.length() && Character.isLowSurrogate(value.charAt(i + 1))) {
                out.append(c).append(value.charAt(++i));
            } else if (!Character.isSurrogate(c)) {
                out.append(c);
            }
        }
        return out.toString();
    }
}
