package com.featurelab.orchestrator.repository;

import com.featurelab.orchestrator.model.Featureset;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + visibility queries for the featuresets table.
 */
public interface FeaturesetRepository extends JpaRepository<Featureset, UUID> {

    /**
     * Every featureset reachable through the ownership chain
     * user → project → featuresets, newest first.
     * Deleted (failed) rows are gone, so they never show up here.
     */
    List<Featureset> findByProjectOwnerOrderByCreatedAtDesc(String owner);
}
