package io.github.riemr.workforce.domain.model;

import lombok.NonNull;
import lombok.Value;

/**
 * 職種（ポジション）。タスクと作業者のマッチングキーとしてのみ使用する。
 */
@Value
public class Position {
    @NonNull
    Long id;
    String name;
}
