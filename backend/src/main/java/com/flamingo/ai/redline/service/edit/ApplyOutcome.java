package com.flamingo.ai.redline.service.edit;

/**
 * Result of one edit.
 *
 * @param editIndex position in the caller's array
 * @param operation operation name
 * @param blockRef block reference as supplied
 * @param resolvedBlockId durable ID the reference resolved to, {@code null} if unresolved
 * @param status outcome
 * @param reason why the edit was not applied, {@code null} when applied
 */
public record ApplyOutcome(
    int editIndex,
    String operation,
    String blockRef,
    String resolvedBlockId,
    OutcomeStatus status,
    String reason) {}
