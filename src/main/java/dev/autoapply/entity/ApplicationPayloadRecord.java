package dev.autoapply.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Serialized submission payload, keyed by queue entry id.
 * Deleted once the entry reaches a terminal state.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "application_payloads")
public class ApplicationPayloadRecord {

    @Id
    private Long queueId;

    @Lob
    @Column(nullable = false)
    private String payloadJson;

    @Column(nullable = false)
    private LocalDateTime createdAt;
}
