package dev.autoapply.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Permanent record of an application that was actually submitted.
 * Only written by a success callback.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_tracker", indexes = {
        @Index(name = "idx_job_tracker_user_applied", columnList = "userId,appliedAt"),
        @Index(name = "idx_job_tracker_external_id", columnList = "externalJobId")
})
public class JobTrackerRecord {

    public static final String STATUS_APPLIED = "Applied";
    public static final String APPLICATION_STATUS_APPLIED = "applied";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false)
    private String jobTitle;

    @Column(nullable = false)
    private String company;

    @Column(length = 2048)
    private String link;

    @Column(nullable = false)
    private String status;

    private String applicationStatus;

    private String source;

    private String externalJobId;

    private Integer matchScore;

    private LocalDateTime appliedAt;

    private LocalDateTime submittedAt;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;
}
