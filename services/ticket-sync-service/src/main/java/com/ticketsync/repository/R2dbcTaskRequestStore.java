package com.ticketsync.repository;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.ticketsync.domain.TaskRequest;
import com.ticketsync.domain.Ticket;
import com.ticketsync.domain.TicketStatus;

import io.r2dbc.spi.R2dbcException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@link TaskRequestStore} backed by Spring Data R2DBC. Optimistic locking relies on
 * the {@code @Version} columns of both entities.
 */
@Component
public class R2dbcTaskRequestStore implements TaskRequestStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcTaskRequestStore.class);

    private static final List<String> OPEN_STATUSES = Arrays.stream(TicketStatus.values())
        .filter(TicketStatus::isOpen)
        .map(Enum::name)
        .toList();

    private final TaskRequestRepository requestRepository;
    private final TicketRepository ticketRepository;
    private final R2dbcEntityTemplate template;

    public R2dbcTaskRequestStore(
        TaskRequestRepository requestRepository,
        TicketRepository ticketRepository,
        R2dbcEntityTemplate template
    ) {
        this.requestRepository = requestRepository;
        this.ticketRepository = ticketRepository;
        this.template = template;
    }

    @Override
    @Transactional
    public Mono<PersistedRequest> createWithTickets(TaskRequest request, List<Ticket> tickets) {
        return requestRepository.save(request)
            .flatMap(saved -> ticketRepository.saveAll(tickets)
                .collectList()
                .map(savedTickets -> new PersistedRequest(saved, savedTickets)))
            .doOnSuccess(persisted -> log.debug("Stored request {} with {} ticket stubs",
                persisted.request().getId(), persisted.tickets().size()))
            .onErrorMap(error -> translate("create request " + request.getId(), error));
    }

    @Override
    public Mono<TaskRequest> findRequest(UUID requestId) {
        return requestRepository.findById(requestId)
            .onErrorMap(error -> translate("load request " + requestId, error));
    }

    @Override
    public Flux<TaskRequest> findRequests(RequestFilter filter) {
        Criteria criteria = Criteria.where("ownerId").is(filter.ownerId());
        if (filter.status() != null) {
            criteria = criteria.and("status").is(filter.status());
        }
        if (filter.priority() != null) {
            criteria = criteria.and("priority").is(filter.priority());
        }
        Query query = Query.query(criteria)
            .sort(Sort.by(Sort.Direction.DESC, "createdAt"))
            .offset(filter.offset())
            .limit(filter.size());

        return template.select(TaskRequest.class)
            .matching(query)
            .all()
            .onErrorMap(error -> translate("list requests of " + filter.ownerId(), error));
    }

    @Override
    public Mono<TaskRequest> saveRequest(TaskRequest request) {
        return requestRepository.save(request)
            .onErrorMap(error -> translate("save request " + request.getId(), error));
    }

    @Override
    public Flux<Ticket> findTickets(UUID requestId) {
        return ticketRepository.findByRequestIdOrderByCreatedAtAsc(requestId)
            .onErrorMap(error -> translate("load tickets of request " + requestId, error));
    }

    @Override
    public Flux<Ticket> findOpenLinkedTickets() {
        return ticketRepository.findLinkedTicketsInStatus(OPEN_STATUSES)
            .onErrorMap(error -> translate("load open tickets", error));
    }

    @Override
    public Mono<Ticket> saveTicket(Ticket ticket) {
        return ticketRepository.save(ticket)
            .onErrorMap(error -> translate("save ticket " + ticket.getId(), error));
    }

    static Throwable translate(String operation, Throwable error) {
        if (error instanceof OptimisticLockingFailureException) {
            return new ConflictException("Concurrent modification while trying to " + operation, error);
        }
        if (error instanceof DataAccessException || error instanceof R2dbcException) {
            log.error("Storage failure while trying to {}: {}", operation, error.getMessage());
            return new PersistenceException("Storage unavailable while trying to " + operation, error);
        }
        return error;
    }
}
