package tw.gc.stock.crawler.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.stock.crawler.entities.HolidaySchedule;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface HolidayScheduleRepository extends JpaRepository<HolidaySchedule, LocalDate> {

    List<HolidaySchedule> findByDateBetweenOrderByDateAsc(LocalDate start, LocalDate end);
}
