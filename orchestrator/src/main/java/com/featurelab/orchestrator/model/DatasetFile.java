package com.featurelab.orchestrator.model;

import jakarta.persistence.*;

/**
 * Storage location of one time series within a dataset.
 *
 * DB table: dataset_files  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "dataset_files")
public class DatasetFile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "dataset_id", nullable = false)
    private Dataset dataset;

    // Filesystem path or file: URI of the series JSON.
    @Column(nullable = false, columnDefinition = "TEXT")
    private String uri;

    protected DatasetFile() {}   // required by JPA

    DatasetFile(Dataset dataset, String uri) {
        this.dataset = dataset;
        this.uri     = uri;
    }

    public Long    getId()      { return id; }
    public Dataset getDataset() { return dataset; }
    public String  getUri()     { return uri; }
}
