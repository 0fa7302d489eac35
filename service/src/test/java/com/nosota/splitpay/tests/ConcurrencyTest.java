package com.nosota.splitpay.tests;

import com.nosota.splitpay.TestBase;
import com.nosota.splitpay.dto.GroupSnapshot;
import com.nosota.splitpay.model.ExpenseGroup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Membership changes to one group run concurrently and must leave the split consistent
 * with the final member count.
 */
@DisplayName("4. Concurrency Tests")
public class ConcurrencyTest extends TestBase {

    private static final int THREADS = 8;

    @Test
    void concurrentAddMember_LeavesConsistentSplit() throws Exception {
        String admin = registerUser("admin");
        String group = createGroup(admin, "900");

        List<String> members = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            members.add(registerUser("member"));
        }

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<GroupSnapshot>> futures = new ArrayList<>();
        try {
            for (String member : members) {
                Callable<GroupSnapshot> task = () -> {
                    start.await();
                    return groupLedgerService.addMember(group, member);
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            for (Future<GroupSnapshot> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(30, TimeUnit.SECONDS);
        }

        ExpenseGroup stored = groupRepository.findById(group).orElseThrow();
        assertThat(paymentRepository.countByGroupName(group)).isEqualTo(THREADS + 1);
        assertThat(stored.getSplitAmount()).isEqualByComparingTo(new BigDecimal("100.00"));
    }

    @Test
    void concurrentSubmissions_FromDifferentMembers_AllLand() throws Exception {
        String admin = registerUser("admin");
        String group = createGroup(admin, "400");
        List<String> members = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            String member = registerUser("payer");
            groupLedgerService.addMember(group, member);
            members.add(member);
        }

        ExecutorService executor = Executors.newFixedThreadPool(members.size());
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (String member : members) {
                futures.add(executor.submit(
                        () -> paymentWorkflowService.submitPayment(group, member, new BigDecimal("100"))));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(30, TimeUnit.SECONDS);
        }

        GroupSnapshot snapshot = groupLedgerService.getStatus(group, admin);
        assertThat(snapshot.payments())
                .filteredOn(payment -> members.contains(payment.getUsername()))
                .allSatisfy(payment -> assertThat(payment.getPaidAmount()).isEqualByComparingTo("100.00"));
    }
}
