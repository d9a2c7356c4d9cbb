package com.nana.iep.domain;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * SessionFact - Identity of one learning session.
 *
 * <p>Two extracts that both contain a session with the same date and the
 * same label describe the same session. Equality is therefore defined on
 * {@code (date, value)} only, and this is the key retained per student in
 * the master table so that later extracts can be deduplicated against it.
 *
 * <p>Natural order is date, then value, which keeps stored fact sets and
 * their serialised form stable between runs.
 */
public final class SessionFact implements Comparable<SessionFact> {

    private static final Comparator<SessionFact> ORDER =
            Comparator.comparing(SessionFact::getDate)
                      .thenComparing(SessionFact::getValue);

    private final LocalDate date;
    private final String    value;

    /**
     * @param date  the session date; must not be null
     * @param value the session label; must not be null
     */
    public SessionFact(LocalDate date, String value) {
        this.date  = Objects.requireNonNull(date, "date");
        this.value = Objects.requireNonNull(value, "value");
    }

    public LocalDate getDate() { return date; }

    public String getValue()   { return value; }

    @Override
    public int compareTo(SessionFact other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SessionFact)) return false;
        SessionFact that = (SessionFact) o;
        return date.equals(that.date) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, value);
    }

    @Override
    public String toString() {
        return date + "|" + value;
    }
}
