package com.ticketsync.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;

import com.ticketsync.domain.TaskRequest;
import com.ticketsync.domain.Ticket;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
@DisplayName("R2DBC task request store")
class R2dbcTaskRequestStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private TaskRequestRepository requestRepository;

    @Mock
    private TicketRepository ticketRepository;

    @Mock
    private R2dbcEntityTemplate template;

    @Captor
    private ArgumentCaptor<Collection<String>> statuses;

    private R2dbcTaskRequestStore store;

    @BeforeEach
    void setUp() {
        store = new R2dbcTaskRequestStore(requestRepository, ticketRepository, template);
    }

    private static TaskRequest request() {
        return TaskRequest.newRequest("alice", "Onboarding", null, null, null, null, 3, NOW);
    }

    @Test
    @DisplayName("stores a request together with its ticket stubs")
    void createsRequestWithTickets() {
        // Given
        TaskRequest request = request();
        Ticket ticket = Ticket.stub(request.getId(), "Laptop", null, null, null, null, null, null, NOW);
        when(requestRepository.save(request)).thenReturn(Mono.just(request));
        when(ticketRepository.saveAll(List.of(ticket))).thenReturn(Flux.just(ticket));

        // When & Then
        StepVerifier.create(store.createWithTickets(request, List.of(ticket)))
            .assertNext(persisted -> {
                assertThat(persisted.request()).isSameAs(request);
                assertThat(persisted.tickets()).containsExactly(ticket);
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("reports a lost update as a conflict")
    void translatesOptimisticLockFailure() {
        // Given
        TaskRequest request = request();
        when(requestRepository.save(request))
            .thenReturn(Mono.error(new OptimisticLockingFailureException("version mismatch")));

        // When & Then
        StepVerifier.create(store.saveRequest(request))
            .expectErrorSatisfies(error -> assertThat(error)
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("save request " + request.getId())
                .hasCauseInstanceOf(OptimisticLockingFailureException.class))
            .verify();
    }

    @Test
    @DisplayName("reports an unreachable database as unavailable")
    void translatesDataAccessFailure() {
        // Given
        Ticket ticket = Ticket.stub(request().getId(), "Laptop", null, null, null, null, null, null, NOW);
        when(ticketRepository.save(any(Ticket.class)))
            .thenReturn(Mono.error(new DataAccessResourceFailureException("connection refused")));

        // When & Then
        StepVerifier.create(store.saveTicket(ticket))
            .expectError(PersistenceException.class)
            .verify();
    }

    @Test
    @DisplayName("queries linked tickets in open statuses only")
    void findsOpenLinkedTickets() {
        // Given
        when(ticketRepository.findLinkedTicketsInStatus(anyCollection())).thenReturn(Flux.empty());

        // When
        StepVerifier.create(store.findOpenLinkedTickets()).verifyComplete();

        // Then
        verify(ticketRepository).findLinkedTicketsInStatus(statuses.capture());
        assertThat(statuses.getValue()).containsExactlyInAnyOrder("NEW", "IN_PROGRESS", "ON_HOLD");
    }

    @Test
    @DisplayName("passes unrelated errors through untouched")
    void keepsOtherErrors() {
        IllegalStateException error = new IllegalStateException("bug");

        assertThat(R2dbcTaskRequestStore.translate("load request", error)).isSameAs(error);
    }
}
