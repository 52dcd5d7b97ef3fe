package com.qcollector.backend.repository;

import com.qcollector.backend.entity.MigrationJob;
import com.qcollector.backend.entity.MigrationJobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface MigrationJobRepository extends JpaRepository<MigrationJob, Long> {

    Optional<MigrationJob> findFirstByStatusAndAvailableAtLessThanEqualOrderByPriorityAscIdAsc(
            MigrationJobStatus status, LocalDateTime now);

    List<MigrationJob> findByFormIdAndStatusInOrderByPriorityAscIdAsc(String formId,
                                                                      Collection<MigrationJobStatus> statuses);

    @Query("select j from MigrationJob j where j.status = :status and (j.leaseUntil is null or j.leaseUntil < :now)")
    List<MigrationJob> findExpiredLeases(@Param("status") MigrationJobStatus status, @Param("now") LocalDateTime now);

    long countByStatus(MigrationJobStatus status);

    long countByStatusAndAvailableAtAfter(MigrationJobStatus status, LocalDateTime now);

    @Query("select j.status as status, count(j.id) as total from MigrationJob j where j.formId = :formId group by j.status")
    List<StatusCount> countByStatusForForm(@Param("formId") String formId);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM MigrationJob j WHERE j.status = :status AND j.finishedAt < :before")
    int deleteFinishedBefore(@Param("status") MigrationJobStatus status, @Param("before") LocalDateTime before);

    interface StatusCount {
        MigrationJobStatus getStatus();

        long getTotal();
    }
}
