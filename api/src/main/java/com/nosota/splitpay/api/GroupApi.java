package com.nosota.splitpay.api;

import com.nosota.splitpay.api.request.AddMemberRequest;
import com.nosota.splitpay.api.request.CreateGroupRequest;
import com.nosota.splitpay.api.request.PaymentDecisionRequest;
import com.nosota.splitpay.api.request.PaymentRequest;
import com.nosota.splitpay.api.response.GroupResponse;
import com.nosota.splitpay.api.response.MembershipResponse;
import com.nosota.splitpay.api.response.PaymentResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Group API for expense groups, membership and the payment approval workflow.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>GroupController - in service module (server-side implementation)</li>
 *   <li>GroupClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/groups")
public interface GroupApi {

    // ==================== Group Ledger ====================

    /**
     * Creates a group administered by the caller.
     *
     * @param authorization {@code Bearer <access token>}
     * @param request       Group name, budget and whether the creator is a member
     * @return Group snapshot; 400 if the name is taken or the budget is not positive
     */
    @PostMapping("/create")
    ResponseEntity<GroupResponse> createGroup(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody @Valid CreateGroupRequest request);

    /**
     * Adds a registered user to a group and recomputes the split.
     *
     * @param request Username and group name
     * @return Recomputed share per member; 404 if the user or group does not exist
     */
    @PostMapping("/add-user")
    ResponseEntity<MembershipResponse> addMember(
            @RequestBody @Valid AddMemberRequest request);

    /**
     * Returns the full group snapshot. Only members may read it.
     */
    @GetMapping("/{groupName}/status")
    ResponseEntity<GroupResponse> getStatus(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable("groupName") String groupName);

    /**
     * Lists all groups. No authentication required.
     */
    @GetMapping
    ResponseEntity<List<GroupResponse>> listGroups();

    // ==================== Payment Workflow ====================

    /**
     * Reports a payment of the caller's share.
     *
     * @return Payment snapshot; 403 if the caller is not a member, 400 if the amount exceeds the split
     */
    @PostMapping("/{groupName}/pay")
    ResponseEntity<PaymentResponse> submitPayment(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable("groupName") String groupName,
            @RequestBody @Valid PaymentRequest request);

    /**
     * Approves or denies a member's payment. Only the group admin may decide.
     *
     * @return Payment snapshot; 403 if the caller is not the admin, 404 if the member has no payment
     */
    @PostMapping("/{groupName}/approve")
    ResponseEntity<PaymentResponse> decidePayment(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable("groupName") String groupName,
            @RequestBody @Valid PaymentDecisionRequest request);
}
