package com.nosota.splitpay.repository;

import com.nosota.splitpay.model.MemberPayment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MemberPaymentRepository extends JpaRepository<MemberPayment, Long> {

    Optional<MemberPayment> findByGroupNameAndUsername(String groupName, String username);

    boolean existsByGroupNameAndUsername(String groupName, String username);

    long countByGroupName(String groupName);

    List<MemberPayment> findByGroupNameOrderByUsernameAsc(String groupName);
}
