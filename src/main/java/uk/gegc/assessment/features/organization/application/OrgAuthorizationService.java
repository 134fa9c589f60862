package uk.gegc.assessment.features.organization.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.assessment.features.organization.domain.model.OrgRole;
import uk.gegc.assessment.features.organization.domain.model.OrganizationMember;
import uk.gegc.assessment.features.organization.domain.repository.OrganizationMemberRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * Organization role gate used by the manager-only reads (violations and analytics).
 * Membership itself is managed elsewhere; this component only answers role questions.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrgAuthorizationService {

    private final OrganizationMemberRepository memberRepository;

    @Transactional(readOnly = true)
    public Optional<OrgRole> roleOf(UUID userId, UUID organizationId) {
        if (userId == null || organizationId == null) {
            return Optional.empty();
        }
        return memberRepository.findByOrganizationIdAndUserId(organizationId, userId)
                .map(OrganizationMember::getRole);
    }

    @Transactional(readOnly = true)
    public boolean hasMinimumRole(UUID userId, UUID organizationId, OrgRole required) {
        boolean allowed = roleOf(userId, organizationId)
                .map(role -> OrgRole.hasMinimumRole(role, required))
                .orElse(false);
        if (!allowed) {
            log.debug("User {} lacks role {} in organization {}", userId, required, organizationId);
        }
        return allowed;
    }
}
