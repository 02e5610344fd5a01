package com.xendex.backend.repositories;

import com.xendex.backend.models.SuppressedEmail;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SuppressedEmailRepository extends JpaRepository<SuppressedEmail, Long> {

    boolean existsByEmailIgnoreCase(String email);
}
