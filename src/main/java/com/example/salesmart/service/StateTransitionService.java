package com.example.salesmart.service;

import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.example.salesmart.entity.StateTransition;
import com.example.salesmart.repo.StateTransitionRepository;

import lombok.RequiredArgsConstructor;

/**
 * Append-only audit log. Each entry commits on its own so a later failure in
 * the caller never erases it.
 */
@Service
@RequiredArgsConstructor
public class StateTransitionService {

    public static final String ENTITY_DISCOVERED_PRODUCT = "DISCOVERED_PRODUCT";
    public static final String ENTITY_DISCOVERY_RUN = "DISCOVERY_RUN";

    private final StateTransitionRepository repo;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void log(
            String entityType,
            Long entityId,
            String fromState,
            String toState,
            String reasonCode,
            String reasonDetail,
            String actor,
            String correlationId) {
        StateTransition st = new StateTransition();
        st.setEntityType(entityType);
        st.setEntityId(entityId);
        st.setFromState(fromState);
        st.setToState(toState);
        st.setReasonCode(reasonCode);
        st.setReasonDetail(truncate(reasonDetail, 2000));
        st.setActor(actor == null || actor.isBlank() ? "SYSTEM" : actor);
        st.setCorrelationId(correlationId);
        st.setCreatedAt(LocalDateTime.now());
        repo.save(st);
    }

    private static String truncate(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }
}
