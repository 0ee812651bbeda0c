package io.github.riemr.workforce.domain.model;

/**
 * マッチング用の職種キー。職種未設定は {@link #NONE} に集約され、
 * タスク側・作業者側の双方で同一キーとして扱う。
 */
public record PositionKey(Long positionId) {

    public static final PositionKey NONE = new PositionKey(null);

    public static PositionKey of(Position position) {
        return position == null ? NONE : new PositionKey(position.getId());
    }

    public boolean isNone() {
        return positionId == null;
    }

    @Override
    public String toString() {
        return isNone() ? "Unassigned" : "P" + positionId;
    }
}
