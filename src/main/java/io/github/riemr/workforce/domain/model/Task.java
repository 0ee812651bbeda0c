package io.github.riemr.workforce.domain.model;

import lombok.NonNull;
import lombok.Value;

import java.time.LocalDate;

/**
 * 割当対象の作業。所要時間（時間単位）と実施日を持ち、エンジンからは不変入力として扱う。
 */
@Value
public class Task {
    @NonNull
    Long id;
    Position position;
    int duration;
    @NonNull
    LocalDate date;

    public Task(@NonNull Long id, Position position, int duration, @NonNull LocalDate date) {
        if (duration <= 0) {
            throw new IllegalArgumentException("duration must be positive: task " + id + " has " + duration);
        }
        this.id = id;
        this.position = position;
        this.duration = duration;
        this.date = date;
    }

    public PositionKey positionKey() {
        return PositionKey.of(position);
    }
}
