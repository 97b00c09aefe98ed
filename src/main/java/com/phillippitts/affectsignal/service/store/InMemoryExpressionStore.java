package com.phillippitts.affectsignal.service.store;

import com.phillippitts.affectsignal.domain.QuestionExpression;
import com.phillippitts.affectsignal.domain.RoundRecord;
import com.phillippitts.affectsignal.exception.DuplicateKeyException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session-scoped {@link ExpressionStore} held in memory.
 *
 * <p>Writes arrive in resolution order, which differs from capture order whenever one
 * question's job is slower than the next; reads always sort by {@link QuestionExpression#sequence()}.
 *
 * <p><b>Thread Safety:</b> all access goes through a single {@link ReentrantLock}.
 */
public final class InMemoryExpressionStore implements ExpressionStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryExpressionStore.class);

    private static final Comparator<QuestionExpression> CAPTURE_ORDER =
            Comparator.comparingLong(QuestionExpression::sequence);

    private final Lock lock = new ReentrantLock();
    private final Map<String, QuestionExpression> byQuestion = new HashMap<>();

    @Override
    public void put(QuestionExpression expression) {
        Objects.requireNonNull(expression, "expression");
        lock.lock();
        try {
            if (byQuestion.containsKey(expression.questionId())) {
                throw new DuplicateKeyException(expression.questionId());
            }
            byQuestion.put(expression.questionId(), expression);
        } finally {
            lock.unlock();
        }
        LOG.debug("Stored {} expression for question {} (round {}, seq {})",
                expression.source(), expression.questionId(), expression.roundId(), expression.sequence());
    }

    @Override
    public Optional<QuestionExpression> get(String questionId) {
        if (questionId == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(byQuestion.get(questionId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean contains(String questionId) {
        return get(questionId).isPresent();
    }

    @Override
    public List<QuestionExpression> all() {
        List<QuestionExpression> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(byQuestion.values());
        } finally {
            lock.unlock();
        }
        snapshot.sort(CAPTURE_ORDER);
        return List.copyOf(snapshot);
    }

    @Override
    public RoundRecord round(String roundId) {
        Objects.requireNonNull(roundId, "roundId");
        List<QuestionExpression> matching = new ArrayList<>();
        for (QuestionExpression e : all()) {
            if (roundId.equals(e.roundId())) {
                matching.add(e);
            }
        }
        return new RoundRecord(roundId, matching);
    }

    @Override
    public List<RoundRecord> rounds() {
        Map<String, List<QuestionExpression>> grouped = new LinkedHashMap<>();
        for (QuestionExpression e : all()) {
            grouped.computeIfAbsent(e.roundId(), k -> new ArrayList<>()).add(e);
        }
        List<RoundRecord> rounds = new ArrayList<>(grouped.size());
        for (Map.Entry<String, List<QuestionExpression>> entry : grouped.entrySet()) {
            rounds.add(new RoundRecord(entry.getKey(), entry.getValue()));
        }
        return rounds;
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return byQuestion.size();
        } finally {
            lock.unlock();
        }
    }
}
