package com.qcollector.backend.repository;

import com.qcollector.backend.entity.FieldMigration;
import com.qcollector.backend.entity.MigrationType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface FieldMigrationRepository extends JpaRepository<FieldMigration, UUID> {

    List<FieldMigration> findByFormIdOrderByExecutedAtDesc(String formId);

    List<FieldMigration> findByExecutedAtGreaterThanEqualOrderByExecutedAtDesc(LocalDateTime since);

    List<FieldMigration> findByFormIdAndSuccessTrueAndRollbackStatementIsNotNullOrderByExecutedAtDesc(String formId);

    List<FieldMigration> findByBackupId(UUID backupId);

    @Query("select m.migrationType as migrationType, m.success as success, count(m.id) as total from FieldMigration m where m.formId = :formId group by m.migrationType, m.success")
    List<OutcomeCount> countOutcomesForForm(@Param("formId") String formId);

    interface OutcomeCount {
        MigrationType getMigrationType();

        Boolean getSuccess();

        long getTotal();
    }
}
