package com.featurelab.orchestrator.model;

import jakarta.persistence.*;
import java.util.ArrayList;
import java.util.List;

/**
 * An uploaded set of time series belonging to a project.
 *
 * DB table: datasets  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "datasets")
public class Dataset {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "project_id", nullable = false)
    private Project project;

    // One file per time series, featurized in this order.
    @OneToMany(mappedBy = "dataset", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    private List<DatasetFile> files = new ArrayList<>();

    protected Dataset() {}   // required by JPA

    public Dataset(String name, Project project) {
        this.name    = name;
        this.project = project;
    }

    public Long              getId()      { return id; }
    public String            getName()    { return name; }
    public Project           getProject() { return project; }
    public List<DatasetFile> getFiles()   { return files; }

    public DatasetFile addFile(String uri) {
        DatasetFile file = new DatasetFile(this, uri);
        files.add(file);
        return file;
    }

    public boolean isOwnedBy(String username) {
        return project != null && project.isOwnedBy(username);
    }
}
