package io.github.riemr.workforce.optimization.entity;

import io.github.riemr.workforce.domain.model.Assignment;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 作業者×日付ごとの確定済み稼働時間の台帳。
 * <p>1回の割当実行ごとに生成し、実行間で共有しない。
 * 全エントリについて {@code 0 <= hours <= dailyCapacity} を保つ。</p>
 */
public class CapacityLedger {

    private final int dailyCapacity;
    private final Map<WorkerDay, Integer> hours = new LinkedHashMap<>();

    public CapacityLedger(int dailyCapacity) {
        if (dailyCapacity < 0) {
            throw new IllegalArgumentException("dailyCapacity must not be negative: " + dailyCapacity);
        }
        this.dailyCapacity = dailyCapacity;
    }

    /**
     * 解済みの割当集合から台帳を再構築する（最適化戦略の後処理用）。
     */
    public static CapacityLedger fromAssignments(Iterable<Assignment> assignments, int dailyCapacity) {
        CapacityLedger ledger = new CapacityLedger(dailyCapacity);
        for (Assignment a : assignments) {
            ledger.commit(a.getWorker().getId(), a.getWorkDate(), a.getHours());
        }
        return ledger;
    }

    public int getDailyCapacity() {
        return dailyCapacity;
    }

    public int load(Long workerId, LocalDate date) {
        return hours.getOrDefault(new WorkerDay(workerId, date), 0);
    }

    public boolean hasHeadroom(Long workerId, LocalDate date, int requiredHours) {
        return load(workerId, date) + requiredHours <= dailyCapacity;
    }

    public void commit(Long workerId, LocalDate date, int committedHours) {
        if (committedHours < 0) {
            throw new IllegalArgumentException("hours must not be negative: " + committedHours);
        }
        WorkerDay key = new WorkerDay(workerId, date);
        int next = hours.getOrDefault(key, 0) + committedHours;
        if (next > dailyCapacity) {
            throw new IllegalStateException(
                    "capacity exceeded for " + key + ": " + next + " > " + dailyCapacity);
        }
        hours.put(key, next);
    }

    public Set<LocalDate> dates() {
        Set<LocalDate> dates = new TreeSet<>();
        for (WorkerDay key : hours.keySet()) {
            dates.add(key.date());
        }
        return dates;
    }

    /** 単一の作業者×日付で最大の負荷。空なら 0。 */
    public int maxLoad() {
        int max = 0;
        for (int h : hours.values()) {
            max = Math.max(max, h);
        }
        return max;
    }

    public int totalFor(Long workerId) {
        int sum = 0;
        for (var e : hours.entrySet()) {
            if (e.getKey().workerId().equals(workerId)) {
                sum += e.getValue();
            }
        }
        return sum;
    }

    public boolean isEmpty() {
        return hours.isEmpty();
    }

    public Map<WorkerDay, Integer> entries() {
        return Collections.unmodifiableMap(hours);
    }

    @Override
    public String toString() {
        return "CapacityLedger{capacity=" + dailyCapacity + ", entries=" + hours + '}';
    }
}
