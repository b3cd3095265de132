package com.ticketsync.repository;

import java.util.UUID;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.ticketsync.domain.TaskRequest;

/**
 * Reactive persistence gateway for task requests. Spring Data generates the
 * implementation at runtime.
 */
@Repository
public interface TaskRequestRepository extends ReactiveCrudRepository<TaskRequest, UUID> {

}
