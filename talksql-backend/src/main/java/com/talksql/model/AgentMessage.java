package com.talksql.model;

import java.time.Instant;

/**
 * One entry of the per-turn event log.
 *
 * @param stage stage that produced the entry
 * @param content human-readable description
 * @param at time the entry was recorded
 */
public record AgentMessage(AgentStage stage, String content, Instant at) {
}
