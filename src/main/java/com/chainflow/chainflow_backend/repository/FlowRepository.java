package com.chainflow.chainflow_backend.repository;

import com.chainflow.chainflow_backend.model.domain.Flow;

import java.util.List;
import java.util.Optional;

public interface FlowRepository {

    Flow save(Flow flow);

    Optional<Flow> findById(String flowId);

    List<Flow> findAll();

    boolean existsById(String flowId);

    boolean deleteById(String flowId);
}
