package com.printmonitor.models;

import java.time.Instant;

import java.util.Objects;

/**
 * Immutable leaf value carrying the instant it was observed.

 * The value may be null where the leaf is optional (a cleared current job).
 *
 * @param <T> Type of the wrapped value
 */
public final class Stamped<T>
{

    private final T value;

    private final Instant updatedAt;

    public Stamped(T value, Instant updatedAt)
    {
        this.value = value;

        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public static <T> Stamped<T> of(T value, Instant updatedAt)
    {
        return new Stamped<>(value, updatedAt);
    }

    public T getValue()
    {
        return value;
    }

    public Instant getUpdatedAt()
    {
        return updatedAt;
    }

    /**
     * Recency admissibility: an incoming leaf replaces this one when it is not older.
     *
     * @param stored leaf currently held
     * @return true if this leaf may overwrite the stored one
     */
    public boolean supersedes(Stamped<?> stored)
    {
        return stored == null || !updatedAt.isBefore(stored.updatedAt);
    }

    /**
     * Compares values only, ignoring timestamps.
     *
     * @param other other leaf
     * @return true if both leaves hold an equal value
     */
    public boolean sameValue(Stamped<?> other)
    {
        return other != null && Objects.equals(value, other.value);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof Stamped))
        {
            return false;
        }

        var other = (Stamped<?>) o;

        return Objects.equals(value, other.value) && updatedAt.equals(other.updatedAt);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(value, updatedAt);
    }

    @Override
    public String toString()
    {
        return value + "@" + updatedAt;
    }
}
