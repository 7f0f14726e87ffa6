package com.flamingo.ai.redline.exception;

/** Top-level error envelope: {@code {"error": {...}}}. */
public record ApiErrorResponse(ApiError error) {}
