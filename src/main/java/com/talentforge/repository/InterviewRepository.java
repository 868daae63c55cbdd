package com.talentforge.repository;

import com.talentforge.model.Interview;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface InterviewRepository extends JpaRepository<Interview, UUID> {

    Optional<Interview> findFirstByExternalMeetingRef(String externalMeetingRef);
}
