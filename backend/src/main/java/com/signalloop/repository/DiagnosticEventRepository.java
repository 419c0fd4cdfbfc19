package com.signalloop.repository;

import com.signalloop.model.DiagnosticEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DiagnosticEventRepository extends JpaRepository<DiagnosticEvent, Long> {
    List<DiagnosticEvent> findTop50ByOrderByCreatedAtDesc();
    List<DiagnosticEvent> findByPostIdOrderByCreatedAtDesc(String postId);
}
