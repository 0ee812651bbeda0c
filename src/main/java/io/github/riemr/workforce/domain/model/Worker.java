package io.github.riemr.workforce.domain.model;

import lombok.NonNull;
import lombok.Value;

@Value
public class Worker {
    @NonNull
    Long id;
    String name;
    Position position; // null = 職種未設定

    public PositionKey positionKey() {
        return PositionKey.of(position);
    }
}
