package io.github.riemr.workforce.application.repository;

import io.github.riemr.workforce.domain.model.Worker;

import java.util.List;

public interface WorkerRepository {

    /** 現在の作業者名簿 */
    List<Worker> findAll();
}
