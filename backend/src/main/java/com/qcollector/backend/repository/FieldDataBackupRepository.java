package com.qcollector.backend.repository;

import com.qcollector.backend.entity.FieldDataBackup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface FieldDataBackupRepository extends JpaRepository<FieldDataBackup, UUID> {

    List<FieldDataBackup> findByFormIdOrderByCreatedAtDesc(String formId);

    List<FieldDataBackup> findByTableNameAndColumnNameOrderByCreatedAtDesc(String tableName, String columnName);

    @Query("""
        SELECT b FROM FieldDataBackup b
        WHERE b.retentionUntil IS NOT NULL
          AND b.retentionUntil BETWEEN :windowStart AND :windowEnd
        ORDER BY b.retentionUntil ASC
        """)
    List<FieldDataBackup> findExpiringBetween(@Param("windowStart") LocalDateTime windowStart,
                                              @Param("windowEnd") LocalDateTime windowEnd);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM FieldDataBackup b WHERE b.retentionUntil IS NOT NULL AND b.retentionUntil < :now")
    int deleteExpired(@Param("now") LocalDateTime now);
}
