package io.tupledb.common;

/**
 * An unsigned transaction counter identifying a read snapshot.
 * <p>
 * The all-ones value is reserved as {@link #LIVE}, the deletion revision of a row
 * that has never been deleted. It sorts after every real revision and cannot be
 * obtained through {@link #of(long)}.
 */
public record Revision(long value) implements Comparable<Revision> {

    private static final long LIVE_VALUE = -1L;

    public static final Revision ZERO = new Revision(0);
    public static final Revision LIVE = new Revision(LIVE_VALUE);

    public static Revision of(long value) {
        if (value == LIVE_VALUE) {
            throw new IllegalArgumentException("revision value is reserved for the live sentinel");
        }
        return new Revision(value);
    }

    public boolean isLive() {
        return value == LIVE_VALUE;
    }

    public Revision next() {
        if (isLive()) {
            throw new IllegalStateException("live sentinel has no successor");
        }
        if (value == LIVE_VALUE - 1) {
            throw new ArithmeticException("revision space exhausted");
        }
        return new Revision(value + 1);
    }

    public boolean isAfter(Revision other) {
        return compareTo(other) > 0;
    }

    public boolean isAtOrBefore(Revision other) {
        return compareTo(other) <= 0;
    }

    @Override
    public int compareTo(Revision other) {
        return Long.compareUnsigned(this.value, other.value);
    }

    @Override
    public String toString() {
        return isLive() ? "Revision[LIVE]" : "Revision[" + Long.toUnsignedString(value) + "]";
    }
}
