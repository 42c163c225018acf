package com.chronofill.backend.repository;

import com.chronofill.backend.model.BackfillDeadLetter;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BackfillDeadLetterRepository extends JpaRepository<BackfillDeadLetter, Long> {
    List<BackfillDeadLetter> findByRequestIdAndResolvedFalse(Long requestId);

    List<BackfillDeadLetter> findByResolvedFalseOrderByCreatedAtAsc();
}
