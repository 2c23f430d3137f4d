package dev.autoapply.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A discovered posting awaiting processing.
 * Rows are never deleted; the deduplicator only rewrites priority.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_links",
        uniqueConstraints = @UniqueConstraint(name = "uq_job_links_user_url", columnNames = {"userId", "url"}),
        indexes = {
                @Index(name = "idx_job_links_user_status", columnList = "userId,status"),
                @Index(name = "idx_job_links_priority", columnList = "priority")
        })
public class JobLink {

    public static final double DEFAULT_PRIORITY = 1.0;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false, length = 2048)
    private String url;

    private String source;

    private String externalJobId;

    private String query;

    private String title;

    private String company;

    private String location;

    @Lob
    private String description;

    private Integer matchScore;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private JobLinkStatus status = JobLinkStatus.PENDING;

    @Column(nullable = false)
    @Builder.Default
    private double priority = DEFAULT_PRIORITY;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime processedAt;

    @Column(length = 2000)
    private String error;

    @Column(nullable = false)
    @Builder.Default
    private int attemptCount = 0;
}
