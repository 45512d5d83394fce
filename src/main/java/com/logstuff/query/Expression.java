package com.logstuff.query;

/**
 * Node of a parsed LQL filter.
 *
 * Implementations are immutable and compare structurally, so two parses of the same
 * query text are equal.
 */
public interface Expression {
}
