package com.printmonitor.models;

import java.util.Objects;

/**
 * Progress of the job currently printing. Carried inside a {@link Stamped} leaf,
 * which supplies the updatedAt of the job as a whole.
 */
public final class JobProgress
{

    private final String name;

    private final double progressPercent;

    private final Long remainingSeconds;     // null when the device gives no estimate

    public JobProgress(String name, double progressPercent, Long remainingSeconds)
    {
        this.name = Objects.requireNonNull(name, "name");

        this.progressPercent = progressPercent;

        this.remainingSeconds = remainingSeconds;
    }

    public String getName()
    {
        return name;
    }

    public double getProgressPercent()
    {
        return progressPercent;
    }

    public Long getRemainingSeconds()
    {
        return remainingSeconds;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof JobProgress))
        {
            return false;
        }

        var other = (JobProgress) o;

        return name.equals(other.name)
            && Double.compare(progressPercent, other.progressPercent) == 0
            && Objects.equals(remainingSeconds, other.remainingSeconds);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(name, progressPercent, remainingSeconds);
    }

    @Override
    public String toString()
    {
        return name + " " + progressPercent + "% (" + remainingSeconds + "s left)";
    }
}
