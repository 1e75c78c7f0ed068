package com.sheetengine.app.exceptions;

/**
 * Body of every failed request to the document API, as written by
 * {@link GlobalExceptionHandler}. The code names the failure class and the
 * message carries the exception text:
 * {
 *   "code": "DOCUMENT_BUSY",
 *   "message": "Timed out waiting for document 3f2a..."
 * }
 * Codes are DOCUMENT_NOT_FOUND, SHEET_NOT_FOUND, CHART_NOT_FOUND and NOT_FOUND
 * (404), INVALID_REFERENCE, VALIDATION_FAILED and MALFORMED_REQUEST (400),
 * INVALID_OPERATION (409), PERSISTENCE_FAILED (502), DOCUMENT_BUSY (503),
 * STRUCTURAL_EDIT_FAILED and SERVER_ERROR (500).
 */
public class ErrorResponse {
    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
