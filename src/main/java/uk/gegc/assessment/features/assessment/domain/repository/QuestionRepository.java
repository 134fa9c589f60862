package uk.gegc.assessment.features.assessment.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.assessment.features.assessment.domain.model.Question;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface QuestionRepository extends JpaRepository<Question, UUID> {

    List<Question> findByDeckIdOrderByPositionAsc(UUID deckId);

    List<Question> findByIdIn(Collection<UUID> ids);
}
