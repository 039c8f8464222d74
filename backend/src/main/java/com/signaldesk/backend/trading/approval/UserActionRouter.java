package com.signaldesk.backend.trading.approval;

import com.signaldesk.backend.model.Signal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class UserActionRouter {

    static final String APPROVED_REASON = "Approved via chat";
    static final String REJECTED_REASON = "Rejected via chat";

    private final ApprovalWorkflow approvalWorkflow;

    public UserActionResult route(String callbackData, String actorId) {
        return route(UserAction.parse(callbackData, actorId));
    }

    public UserActionResult route(UserAction action) {
        log.info("📱 User action: {} for signal {} by {}", action.action(), action.signalId(), action.actorId());
        String signalId = action.signalId();
        return switch (action.action()) {
            case EXECUTE -> result(action, approvalWorkflow.approve(signalId, action.actorId(), APPROVED_REASON));
            case REJECT -> result(action, approvalWorkflow.reject(signalId, action.actorId(), REJECTED_REASON));
            case DELAY -> result(action, approvalWorkflow.delay(signalId,
                    approvalWorkflow.getSettings().defaultDelayMinutes(), action.actorId()));
            case DETAILS -> {
                Optional<Signal> signal = approvalWorkflow.getSignalDetails(signalId);
                yield new UserActionResult(action.action(), signalId, signal.isPresent(), signal.orElse(null));
            }
        };
    }

    private static UserActionResult result(UserAction action, boolean success) {
        return new UserActionResult(action.action(), action.signalId(), success, null);
    }
}
