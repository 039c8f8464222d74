package com.signaldesk.backend.controller;

import com.signaldesk.backend.dto.ApprovalDecisionRequest;
import com.signaldesk.backend.dto.BulkApproveRequest;
import com.signaldesk.backend.dto.DelayRequest;
import com.signaldesk.backend.dto.EmergencyStopRequest;
import com.signaldesk.backend.dto.MessageResponse;
import com.signaldesk.backend.dto.UserActionRequest;
import com.signaldesk.backend.exception.BadRequestException;
import com.signaldesk.backend.exception.NotFoundException;
import com.signaldesk.backend.trading.approval.ApprovalSettings;
import com.signaldesk.backend.trading.approval.ApprovalWorkflow;
import com.signaldesk.backend.trading.approval.BulkApprovalCriteria;
import com.signaldesk.backend.trading.approval.BulkApprovalResult;
import com.signaldesk.backend.trading.approval.EmergencyRejection;
import com.signaldesk.backend.trading.approval.PendingApprovalView;
import com.signaldesk.backend.trading.approval.QueueStatus;
import com.signaldesk.backend.trading.approval.UserAction;
import com.signaldesk.backend.trading.approval.UserActionResult;
import com.signaldesk.backend.trading.approval.UserActionRouter;
import com.signaldesk.backend.trading.approval.UserActionType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/approvals")
@RequiredArgsConstructor
@Tag(name = "Approvals")
public class ApprovalController {

    private final ApprovalWorkflow approvalWorkflow;
    private final UserActionRouter userActionRouter;

    @GetMapping("/pending")
    @Operation(summary = "List signals waiting for a decision")
    public List<PendingApprovalView> pending() {
        return approvalWorkflow.getPendingApprovals();
    }

    @GetMapping("/status")
    @Operation(summary = "Approval queue summary")
    public QueueStatus status() {
        return approvalWorkflow.getQueueStatus();
    }

    @PostMapping("/{id}/approve")
    @Operation(summary = "Approve a pending signal")
    public ResponseEntity<MessageResponse> approve(@PathVariable String id,
                                                   @Valid @RequestBody(required = false) ApprovalDecisionRequest request) {
        ApprovalDecisionRequest body = request != null ? request : new ApprovalDecisionRequest();
        if (!approvalWorkflow.approve(id, body.getActorId(), body.getReason())) {
            throw notPending(id);
        }
        return ResponseEntity.ok(new MessageResponse("Signal approved"));
    }

    @PostMapping("/{id}/reject")
    @Operation(summary = "Reject a pending signal")
    public ResponseEntity<MessageResponse> reject(@PathVariable String id,
                                                  @Valid @RequestBody(required = false) ApprovalDecisionRequest request) {
        ApprovalDecisionRequest body = request != null ? request : new ApprovalDecisionRequest();
        if (!approvalWorkflow.reject(id, body.getActorId(), body.getReason())) {
            throw notPending(id);
        }
        return ResponseEntity.ok(new MessageResponse("Signal rejected"));
    }

    @PostMapping("/{id}/delay")
    @Operation(summary = "Push back the decision deadline of a pending signal")
    public ResponseEntity<MessageResponse> delay(@PathVariable String id,
                                                 @Valid @RequestBody(required = false) DelayRequest request) {
        DelayRequest body = request != null ? request : new DelayRequest();
        long minutes = body.getMinutes() != null
                ? body.getMinutes()
                : approvalWorkflow.getSettings().defaultDelayMinutes();
        if (!approvalWorkflow.delay(id, minutes, body.getActorId())) {
            throw notPending(id);
        }
        return ResponseEntity.ok(new MessageResponse("Signal delayed by " + minutes + " minutes"));
    }

    @PostMapping("/emergency-stop")
    @Operation(summary = "Reject every pending signal")
    public List<EmergencyRejection> emergencyStop(@RequestBody(required = false) EmergencyStopRequest request) {
        return approvalWorkflow.emergencyRejectAll(request != null ? request.getReason() : null);
    }

    @PostMapping("/bulk-approve")
    @Operation(summary = "Approve every pending signal matching the criteria")
    public List<BulkApprovalResult> bulkApprove(@Valid @RequestBody(required = false) BulkApproveRequest request) {
        BulkApprovalCriteria criteria = request == null
                ? BulkApprovalCriteria.any()
                : new BulkApprovalCriteria(request.getMinConfidence(), request.getDirections(), request.getRiskTiers());
        return approvalWorkflow.bulkApprove(criteria);
    }

    @PostMapping("/actions")
    @Operation(summary = "Handle a decision coming from the notification channel")
    public UserActionResult action(@RequestBody UserActionRequest request) {
        UserAction action;
        if (request.getCallbackData() != null && !request.getCallbackData().isBlank()) {
            action = UserAction.parse(request.getCallbackData(), request.getActorId());
        } else {
            if (request.getSignalId() == null || request.getSignalId().isBlank()) {
                throw new BadRequestException("signalId is required");
            }
            action = new UserAction(UserActionType.fromString(request.getAction()), request.getSignalId(),
                    request.getActorId());
        }
        return userActionRouter.route(action);
    }

    @GetMapping("/settings")
    @Operation(summary = "Current approval settings")
    public ApprovalSettings settings() {
        return approvalWorkflow.getSettings();
    }

    @PatchMapping("/settings")
    @Operation(summary = "Update approvalTimeoutMs, manualApproval or defaultDelayMinutes")
    public Map<String, Object> updateSettings(@RequestBody Map<String, Object> changes) {
        return approvalWorkflow.updateSettings(changes);
    }

    private static NotFoundException notPending(String id) {
        return new NotFoundException("No pending approval for id " + id);
    }
}
