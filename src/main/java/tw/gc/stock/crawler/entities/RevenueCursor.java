package tw.gc.stock.crawler.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Last revenue month ({@code yyyyMM}) already ingested for a security.
 */
@Entity
@Table(name = "revenue_last_date")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevenueCursor {

    @Id
    @Column(name = "security_code", length = 24)
    private String securityCode;

    @Column(name = "month", nullable = false)
    private Long month;

    @Column(name = "updated_time", nullable = false)
    private LocalDateTime updatedTime;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedTime = LocalDateTime.now();
    }
}
