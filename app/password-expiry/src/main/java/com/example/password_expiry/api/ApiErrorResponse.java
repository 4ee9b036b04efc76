/*
 * どこで: Password expiry API
 * 何を: API エラー応答の共通 DTO
 * なぜ: エラー形式を統一し、運用画面で機械的に処理できるようにするため
 */
package com.example.password_expiry.api;

public record ApiErrorResponse(String code, String message) {}
