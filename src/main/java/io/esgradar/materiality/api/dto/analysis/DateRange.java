package io.esgradar.materiality.api.dto.analysis;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record DateRange(
        LocalDate from,
        LocalDate to
) {
    public DateRange {
        if (from == null || to == null || to.isBefore(from)) {
            throw new IllegalArgumentException("Invalid date range: " + from + " ~ " + to);
        }
    }

    public static DateRange ofYear(int year) {
        return new DateRange(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
    }

    public boolean contains(LocalDateTime timestamp) {
        if (timestamp == null) return false;

        LocalDate day = timestamp.toLocalDate();
        return !day.isBefore(from) && !day.isAfter(to);
    }

    @Override
    public String toString() {
        return from + " ~ " + to;
    }
}
