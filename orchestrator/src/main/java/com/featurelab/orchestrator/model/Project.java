package com.featurelab.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Ownership root for datasets and featuresets.
 *
 * Projects are created and managed elsewhere; this service only reads them
 * to resolve who may see a featureset.
 *
 * DB table: projects  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "projects")
public class Project {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    // Username of the owning principal.
    @Column(nullable = false)
    private String owner;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Project() {}   // required by JPA

    public Project(String name, String owner) {
        this.name  = name;
        this.owner = owner;
    }

    public Long    getId()        { return id; }
    public String  getName()      { return name; }
    public String  getOwner()     { return owner; }
    public Instant getCreatedAt() { return createdAt; }

    public boolean isOwnedBy(String username) {
        return owner != null && owner.equals(username);
    }
}
