package com.phillippitts.affectsignal.service.store;

import com.phillippitts.affectsignal.domain.QuestionExpression;
import com.phillippitts.affectsignal.domain.RoundRecord;
import com.phillippitts.affectsignal.exception.DuplicateKeyException;

import java.util.List;
import java.util.Optional;

/**
 * Append-only mapping from question identifier to exactly one {@link QuestionExpression}.
 *
 * <p>Implementations must be thread-safe: resolutions for different questions land
 * concurrently.
 */
public interface ExpressionStore {

    /**
     * Records an expression.
     *
     * @throws DuplicateKeyException if the question already has an expression
     */
    void put(QuestionExpression expression);

    Optional<QuestionExpression> get(String questionId);

    boolean contains(String questionId);

    /**
     * @return every expression, ordered by capture-trigger sequence
     */
    List<QuestionExpression> all();

    /**
     * @return the round's expressions in capture order; an empty record for an unknown round
     */
    RoundRecord round(String roundId);

    /**
     * @return all rounds, ordered by their first capture
     */
    List<RoundRecord> rounds();

    int size();
}
