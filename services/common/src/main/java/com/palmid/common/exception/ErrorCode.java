package com.palmid.common.exception;

/**
 * Error codes for the PalmID platform
 * Format: MODULE_CATEGORY_SPECIFIC_ERROR
 */
public enum ErrorCode {

    // ===== BIOMETRIC ERRORS (BIO_XXX) =====
    BIO_NOT_AVAILABLE("BIO_001", "Palm recognition model not available"),
    BIO_DETECTION_FAILED("BIO_002", "Failed to detect hand keypoints in image"),
    BIO_TIMEOUT("BIO_003", "Hand keypoint detection timed out"),
    BIO_TEMPLATE_CORRUPTED("BIO_004", "Palm template record corrupted"),
    BIO_ALREADY_REGISTERED("BIO_005", "Palm already registered for this identity"),
    BIO_NOT_REGISTERED("BIO_006", "No palm registered for this identity"),
    BIO_NO_COMMON_MEASUREMENTS("BIO_007", "Templates share no common measurements"),
    BIO_MISSING_REFERENCE("BIO_008", "Normalization reference distance missing"),
    BIO_EMPTY_DATABASE("BIO_009", "No registered palms in database"),

    // ===== VALIDATION ERRORS (VAL_XXX) =====
    VAL_INVALID_IDENTITY("VAL_001", "Invalid identity"),
    VAL_INVALID_THRESHOLD("VAL_002", "Invalid match threshold"),
    VAL_IMAGE_NOT_FOUND("VAL_003", "Image not found"),

    // ===== FILE & STORAGE ERRORS (FILE_XXX) =====
    FILE_STORAGE_ERROR("FILE_001", "Palm data storage failure"),

    // ===== SYSTEM ERRORS (SYS_XXX) =====
    SYS_INTERNAL_ERROR("SYS_001", "Internal system error"),
    SYS_USAGE_ERROR("SYS_002", "Invalid command usage");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
