package tw.gc.stock.crawler.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Market closure published by the exchange. Reference data, loaded outside the
 * pipeline.
 */
@Entity
@Table(name = "holiday_schedule")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HolidaySchedule {

    @Id
    @Column(name = "date")
    private LocalDate date;

    @Column(name = "reason", nullable = false)
    @Builder.Default
    private String reason = "";
}
