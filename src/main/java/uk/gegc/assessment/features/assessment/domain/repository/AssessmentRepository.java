package uk.gegc.assessment.features.assessment.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.assessment.domain.model.AssessmentStatus;

import java.util.List;
import java.util.UUID;

@Repository
public interface AssessmentRepository extends JpaRepository<Assessment, UUID> {

    List<Assessment> findByOrganizationId(UUID organizationId);

    @Query("""
            SELECT COUNT(a)
            FROM Assessment a
            WHERE a.organizationId = :orgId
              AND a.status = :status
            """)
    long countByOrganizationIdAndStatus(@Param("orgId") UUID organizationId,
                                        @Param("status") AssessmentStatus status);
}
