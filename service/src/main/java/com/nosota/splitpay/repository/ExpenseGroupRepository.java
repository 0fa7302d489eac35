package com.nosota.splitpay.repository;

import com.nosota.splitpay.model.ExpenseGroup;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ExpenseGroupRepository extends JpaRepository<ExpenseGroup, String> {
    /**
     * Retrieves the {@link ExpenseGroup} with the given name and locks it for update.
     * <p>
     * Every mutation of a group (membership, payment submission, payment decision) goes through
     * this lock, so reading the member count and writing the split happen atomically and
     * concurrent changes to one group are serialized. Different groups do not block each other.
     * </p>
     *
     * @param name The group name.
     * @return The locked group, or empty if no group has that name.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM ExpenseGroup g WHERE g.name = :name")
    Optional<ExpenseGroup> findByNameForUpdate(@Param("name") String name);

    List<ExpenseGroup> findAllByOrderByNameAsc();
}
