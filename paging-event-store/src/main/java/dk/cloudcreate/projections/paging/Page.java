package dk.cloudcreate.projections.paging;

import dk.cloudcreate.projections.Transaction;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The transactions that directly follow {@link #previousCheckpoint()}, ordered by checkpoint
 */
public final class Page {
    private final long              previousCheckpoint;
    private final List<Transaction> transactions;

    public Page(long previousCheckpoint, List<Transaction> transactions) {
        this.previousCheckpoint = previousCheckpoint;
        this.transactions = List.copyOf(requireNonNull(transactions, "No transactions provided"));
    }

    public static Page empty(long previousCheckpoint) {
        return new Page(previousCheckpoint, List.of());
    }

    public long previousCheckpoint() {
        return previousCheckpoint;
    }

    public List<Transaction> transactions() {
        return transactions;
    }

    public boolean isEmpty() {
        return transactions.isEmpty();
    }

    public int size() {
        return transactions.size();
    }

    /**
     * The checkpoint of the last transaction in the page, or {@link Optional#empty()} if the page is empty
     */
    public Optional<Long> lastCheckpoint() {
        return transactions.isEmpty() ? Optional.empty() : Optional.of(transactions.get(transactions.size() - 1).checkpoint());
    }

    @Override
    public String toString() {
        return "Page{" +
                "previousCheckpoint=" + previousCheckpoint +
                ", transactions=" + transactions.size() +
                ", lastCheckpoint=" + lastCheckpoint().map(String::valueOf).orElse("none") +
                '}';
    }
}
