package com.nosota.splitpay.api;

import com.nosota.splitpay.api.request.AddMemberRequest;
import com.nosota.splitpay.api.request.CreateGroupRequest;
import com.nosota.splitpay.api.request.PaymentDecisionRequest;
import com.nosota.splitpay.api.request.PaymentRequest;
import com.nosota.splitpay.api.response.GroupResponse;
import com.nosota.splitpay.api.response.MembershipResponse;
import com.nosota.splitpay.api.response.PaymentResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of GroupApi for consuming the splitpay service.
 *
 * <p>Like {@link AuthClient}, this client is not a Spring component and must be
 * registered as a bean by the consuming service.
 */
@RequiredArgsConstructor
@Slf4j
public class GroupClient implements GroupApi {

    private final WebClient webClient;

    // ==================== Group Ledger ====================

    @Override
    public ResponseEntity<GroupResponse> createGroup(String authorization, CreateGroupRequest request) {
        log.debug("Calling createGroup: groupName={}, budget={}", request.groupName(), request.budget());

        return webClient.post()
                .uri("/api/v1/groups/create")
                .headers(headers -> AuthClient.setAuthorization(headers, authorization))
                .bodyValue(request)
                .retrieve()
                .toEntity(GroupResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<MembershipResponse> addMember(AddMemberRequest request) {
        log.debug("Calling addMember: username={}, groupName={}", request.username(), request.groupName());

        return webClient.post()
                .uri("/api/v1/groups/add-user")
                .bodyValue(request)
                .retrieve()
                .toEntity(MembershipResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<GroupResponse> getStatus(String authorization, String groupName) {
        log.debug("Calling getStatus: groupName={}", groupName);

        return webClient.get()
                .uri("/api/v1/groups/{groupName}/status", groupName)
                .headers(headers -> AuthClient.setAuthorization(headers, authorization))
                .retrieve()
                .toEntity(GroupResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<GroupResponse>> listGroups() {
        log.debug("Calling listGroups");

        return webClient.get()
                .uri("/api/v1/groups")
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<GroupResponse>>() {})
                .block();
    }

    // ==================== Payment Workflow ====================

    @Override
    public ResponseEntity<PaymentResponse> submitPayment(String authorization, String groupName,
                                                         PaymentRequest request) {
        log.debug("Calling submitPayment: groupName={}, amount={}", groupName, request.amount());

        return webClient.post()
                .uri("/api/v1/groups/{groupName}/pay", groupName)
                .headers(headers -> AuthClient.setAuthorization(headers, authorization))
                .bodyValue(request)
                .retrieve()
                .toEntity(PaymentResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PaymentResponse> decidePayment(String authorization, String groupName,
                                                         PaymentDecisionRequest request) {
        log.debug("Calling decidePayment: groupName={}, username={}, action={}",
                groupName, request.username(), request.action());

        return webClient.post()
                .uri("/api/v1/groups/{groupName}/approve", groupName)
                .headers(headers -> AuthClient.setAuthorization(headers, authorization))
                .bodyValue(request)
                .retrieve()
                .toEntity(PaymentResponse.class)
                .block();
    }
}
