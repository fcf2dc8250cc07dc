package tw.gc.stock.crawler.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * JobExecution Entity - Latest run of a scheduled job for a business date.
 * Re-running the same (job, date) overwrites this row.
 */
@Entity
@Table(name = "job_execution",
    uniqueConstraints = @UniqueConstraint(name = "uk_job_execution_name_date",
        columnNames = {"job_name", "business_date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_name", nullable = false, length = 64)
    private String jobName;

    @Column(name = "business_date", nullable = false)
    private LocalDate businessDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private Status status;

    @Column(name = "run_count", nullable = false)
    @Builder.Default
    private Integer runCount = 0;

    @Column(name = "fetched", nullable = false)
    @Builder.Default
    private Integer fetched = 0;

    @Column(name = "merged", nullable = false)
    @Builder.Default
    private Integer merged = 0;

    @Column(name = "failed", nullable = false)
    @Builder.Default
    private Integer failed = 0;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    public enum Status {
        RUNNING,
        SUCCEEDED,
        PARTIAL,
        FAILED,
        SKIPPED
    }
}
