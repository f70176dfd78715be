package dustin.clearing.domains.participant.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.clearing.domains.participant.model.ParticipantRole;
import dustin.clearing.domains.participant.model.entity.Participant;

/**
 * 참여자 리포지토리
 * Participant Repository
 */
@Repository
public interface ParticipantRepository extends JpaRepository<Participant, Long> {

    Optional<Participant> findByExternalId(String externalId);

    List<Participant> findByExternalIdIn(Collection<String> externalIds);

    /**
     * 상대방 역할(임대인, 운영자, 외부 시장, 수수료 수취인) 조회용
     */
    List<Participant> findByRoleIn(Collection<ParticipantRole> roles);
}
