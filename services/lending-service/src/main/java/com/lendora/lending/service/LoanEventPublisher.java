package com.lendora.lending.service;

import com.lendora.lending.config.LendingProperties;
import com.lendora.lending.domain.Loan;
import com.lendora.lending.domain.ProtocolParameterChange;
import com.lendora.lending.domain.ProtocolParameters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Publishes loan lifecycle and parameter change events after the owning transaction committed.
 * A failed publish is logged and never undoes or blocks the committed operation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanEventPublisher {

    public static final String LOAN_ORIGINATED = "LOAN_ORIGINATED";
    public static final String LOAN_REPAYMENT = "LOAN_REPAYMENT";
    public static final String LOAN_REPAID = "LOAN_REPAID";
    public static final String LOAN_LIQUIDATED = "LOAN_LIQUIDATED";
    public static final String LOAN_DEFAULTED = "LOAN_DEFAULTED";
    public static final String PARAMETERS_CHANGED = "PROTOCOL_PARAMETERS_CHANGED";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final LendingProperties properties;
    private final Clock clock;

    public void publishLoanEvent(String eventType, Loan loan, Map<String, Object> details) {
        if (!properties.getEvents().isEnabled()) {
            return;
        }
        try {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("eventType", eventType);
            event.put("loanId", loan.getId());
            event.put("loanNumber", loan.getLoanNumber());
            event.put("borrowerId", loan.getBorrowerId());
            event.put("lenderId", loan.getLenderId());
            event.put("status", loan.getStatus());
            event.put("outstandingBalance", loan.getOutstandingBalance());
            event.put("collateralAsset", loan.getCollateralAsset());
            event.putAll(details);
            event.put("timestamp", Instant.now(clock));

            send(properties.getEvents().getLoanTopic(), loan.getId().toString(), event);
        } catch (Exception e) {
            log.error("Failed to publish {} event for loan {}", eventType, loan.getId(), e);
        }
    }

    public void publishParameterChange(ProtocolParameters parameters, List<ProtocolParameterChange> changes) {
        if (!properties.getEvents().isEnabled()) {
            return;
        }
        try {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("eventType", PARAMETERS_CHANGED);
            event.put("version", parameters.getVersion());
            event.put("changes", changes.stream()
                    .collect(Collectors.toMap(change -> change.getParameter().name(), ProtocolParameterChange::getNewValue,
                            (first, second) -> second, LinkedHashMap::new)));
            event.put("changedBy", changes.isEmpty() ? null : changes.get(0).getChangedBy());
            event.put("timestamp", Instant.now(clock));

            send(properties.getEvents().getParameterTopic(), String.valueOf(parameters.getVersion()), event);
        } catch (Exception e) {
            log.error("Failed to publish parameter change event for version {}", parameters.getVersion(), e);
        }
    }

    private void send(String topic, String key, Map<String, Object> event) {
        kafkaTemplate.send(topic, key, event).whenComplete((result, failure) -> {
            if (failure != null) {
                log.error("Delivery of {} to {} failed", event.get("eventType"), topic, failure);
            } else {
                log.debug("Published {} to {} with key {}", event.get("eventType"), topic, key);
            }
        });
    }
}
