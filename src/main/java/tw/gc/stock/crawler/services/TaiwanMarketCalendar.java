package tw.gc.stock.crawler.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.stock.crawler.entities.HolidaySchedule;
import tw.gc.stock.crawler.repositories.HolidayScheduleRepository;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

/**
 * Taiwan stock exchange calendar.
 *
 * <h3>Non-trading days:</h3>
 * <ul>
 *   <li>Saturdays and Sundays</li>
 *   <li>Dates listed in {@code holiday_schedule}</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaiwanMarketCalendar {

    private final HolidayScheduleRepository holidayScheduleRepository;

    // ========== Holiday Checking ==========

    public boolean isHoliday(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return true;
        }
        return holidayScheduleRepository.existsById(date);
    }

    public boolean isTradingDay(LocalDate date) {
        return !isHoliday(date);
    }

    /**
     * Exchange holidays of a year, weekends excluded.
     */
    public List<HolidaySchedule> getHolidays(int year) {
        return holidayScheduleRepository.findByDateBetweenOrderByDateAsc(
            LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
    }
}
