package com.example.predictor.registry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import com.example.predictor.exception.ModelUnavailableException;
import com.example.predictor.exception.ScoringException;
import com.example.predictor.model.Capability;
import com.example.predictor.model.IssueType;
import com.example.predictor.model.ModelScore;

/**
 * Wraps a raw unit so that every fault surfaces as {@link ScoringException}: thrown runtime
 * exceptions, a missing result, and runs slower than the time budget (result discarded).
 */
public class GuardedScoringUnit implements ScoringUnit {

    public record Stats(long calls, long failures, long overBudget) {}

    private final ScoringUnit delegate;
    private final long budgetNanos;
    private final AtomicLong calls = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong overBudget = new AtomicLong();

    public GuardedScoringUnit(ScoringUnit delegate, Duration budget) {
        this.delegate = delegate;
        this.budgetNanos = budget.toNanos();
    }

    @Override
    public Capability capability() {
        return delegate.capability();
    }

    @Override
    public String version() {
        return delegate.version();
    }

    @Override
    public ModelScore score(String message, IssueType issueType) {
        calls.incrementAndGet();
        long start = System.nanoTime();
        ModelScore result;
        try {
            result = delegate.score(message, issueType);
        } catch (ScoringException | ModelUnavailableException e) {
            failures.incrementAndGet();
            throw e;
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            throw new ScoringException(describe() + " failed: " + e.getMessage(), e);
        }

        long elapsed = System.nanoTime() - start;
        if (elapsed > budgetNanos) {
            overBudget.incrementAndGet();
            failures.incrementAndGet();
            throw new ScoringException(describe() + " exceeded its time budget ("
                + Duration.ofNanos(elapsed).toMillis() + "ms > " + Duration.ofNanos(budgetNanos).toMillis() + "ms)");
        }
        if (result == null) {
            failures.incrementAndGet();
            throw new ScoringException(describe() + " returned no score");
        }
        return result;
    }

    public Stats stats() {
        return new Stats(calls.get(), failures.get(), overBudget.get());
    }

    private String describe() {
        return delegate.capability().wireName() + " model v" + delegate.version();
    }
}
