package com.talentforge.repository;

import com.talentforge.model.EmailSuppression;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface EmailSuppressionRepository extends JpaRepository<EmailSuppression, UUID> {

    boolean existsByCompanyIdAndEmail(UUID companyId, String email);
}
