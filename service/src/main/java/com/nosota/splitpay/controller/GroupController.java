package com.nosota.splitpay.controller;

import com.nosota.splitpay.api.GroupApi;
import com.nosota.splitpay.api.dto.PaymentDTO;
import com.nosota.splitpay.api.request.AddMemberRequest;
import com.nosota.splitpay.api.request.CreateGroupRequest;
import com.nosota.splitpay.api.request.PaymentDecisionRequest;
import com.nosota.splitpay.api.request.PaymentRequest;
import com.nosota.splitpay.api.response.GroupResponse;
import com.nosota.splitpay.api.response.MembershipResponse;
import com.nosota.splitpay.api.response.PaymentResponse;
import com.nosota.splitpay.dto.GroupSnapshot;
import com.nosota.splitpay.mapper.PaymentMapper;
import com.nosota.splitpay.model.ExpenseGroup;
import com.nosota.splitpay.model.MemberPayment;
import com.nosota.splitpay.security.AccessControlGate;
import com.nosota.splitpay.security.TokenClaims;
import com.nosota.splitpay.service.GroupLedgerService;
import com.nosota.splitpay.service.PaymentWorkflowService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST controller for expense groups and member payments.
 *
 * <p>Implements {@link GroupApi} interface for:
 * <ul>
 *   <li>Group ledger operations (create, add member, status, list)</li>
 *   <li>Payment workflow operations (submit, approve/deny)</li>
 * </ul>
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class GroupController implements GroupApi {

    private final GroupLedgerService groupLedgerService;
    private final PaymentWorkflowService paymentWorkflowService;
    private final AccessControlGate accessControlGate;

    // ==================== Group Ledger ====================

    @Override
    public ResponseEntity<GroupResponse> createGroup(String authorization, CreateGroupRequest request) {
        TokenClaims claims = accessControlGate.authenticateRequest(authorization);
        boolean addCreator = request.addCreator() == null || request.addCreator();

        log.info("Create group request: groupName={}, budget={}, admin={}, addCreator={}",
                request.groupName(), request.budget(), claims.subject(), addCreator);

        GroupSnapshot snapshot = groupLedgerService.createGroup(
                request.groupName(), claims.subject(), request.budget(), addCreator);
        return ResponseEntity.status(HttpStatus.CREATED).body(toGroupResponse(snapshot));
    }

    @Override
    public ResponseEntity<MembershipResponse> addMember(AddMemberRequest request) {
        GroupSnapshot snapshot = groupLedgerService.addMember(request.groupName(), request.username());

        MembershipResponse response = new MembershipResponse(
                "User '" + request.username() + "' added",
                snapshot.group().getSplitAmount()
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<GroupResponse> getStatus(String authorization, String groupName) {
        TokenClaims claims = accessControlGate.authenticateRequest(authorization);
        GroupSnapshot snapshot = groupLedgerService.getStatus(groupName, claims.subject());
        return ResponseEntity.ok(toGroupResponse(snapshot));
    }

    @Override
    public ResponseEntity<List<GroupResponse>> listGroups() {
        List<GroupResponse> groups = groupLedgerService.listGroups().stream()
                .map(this::toGroupResponse)
                .toList();
        return ResponseEntity.ok(groups);
    }

    // ==================== Payment Workflow ====================

    @Override
    public ResponseEntity<PaymentResponse> submitPayment(String authorization, String groupName,
                                                         PaymentRequest request) {
        TokenClaims claims = accessControlGate.authenticateRequest(authorization);
        MemberPayment payment = paymentWorkflowService.submitPayment(groupName, claims.subject(), request.amount());

        PaymentResponse response = new PaymentResponse(
                "Payment submitted, pending approval",
                groupName,
                PaymentMapper.INSTANCE.toDTO(payment)
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<PaymentResponse> decidePayment(String authorization, String groupName,
                                                         PaymentDecisionRequest request) {
        TokenClaims claims = accessControlGate.authenticateRequest(authorization);
        MemberPayment payment = paymentWorkflowService.decidePayment(
                groupName, claims.subject(), request.username(), request.action());

        PaymentResponse response = new PaymentResponse(
                request.username() + "'s payment " + payment.getStatus().name().toLowerCase(Locale.ROOT),
                groupName,
                PaymentMapper.INSTANCE.toDTO(payment)
        );
        return ResponseEntity.ok(response);
    }

    // ==================== Private Helper Methods ====================

    private GroupResponse toGroupResponse(GroupSnapshot snapshot) {
        ExpenseGroup group = snapshot.group();

        Map<String, PaymentDTO> payments = new LinkedHashMap<>();
        for (PaymentDTO payment : PaymentMapper.INSTANCE.toDTOList(snapshot.payments())) {
            payments.put(payment.username(), payment);
        }

        return new GroupResponse(
                group.getName(),
                group.getAdmin(),
                group.getBudget(),
                group.getSplitAmount(),
                snapshot.members(),
                payments,
                group.getCreatedAt()
        );
    }
}
