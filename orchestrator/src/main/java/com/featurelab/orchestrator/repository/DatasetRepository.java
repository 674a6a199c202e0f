package com.featurelab.orchestrator.repository;

import com.featurelab.orchestrator.model.Dataset;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Read access to uploaded datasets.
 */
public interface DatasetRepository extends JpaRepository<Dataset, Long> {

    /**
     * Load a dataset with its project and file list in one query.
     * The submission path reads both outside any open persistence context.
     */
    @EntityGraph(attributePaths = {"project", "files"})
    Optional<Dataset> findWithFilesById(Long id);
}
