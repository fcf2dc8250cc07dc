package tw.gc.stock.crawler.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tw.gc.stock.crawler.repositories.HolidayScheduleRepository;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaiwanMarketCalendarTest {

    @Mock
    private HolidayScheduleRepository holidayScheduleRepository;

    private TaiwanMarketCalendar calendar;

    @BeforeEach
    void setUp() {
        calendar = new TaiwanMarketCalendar(holidayScheduleRepository);
    }

    @Test
    void weekendsAreNeverTradingDays() {
        assertThat(calendar.isTradingDay(LocalDate.of(2024, 3, 2))).isFalse();
        assertThat(calendar.isTradingDay(LocalDate.of(2024, 3, 3))).isFalse();
        verifyNoInteractions(holidayScheduleRepository);
    }

    @Test
    void scheduledHolidayIsNotATradingDay() {
        LocalDate lunarNewYear = LocalDate.of(2024, 2, 8);
        when(holidayScheduleRepository.existsById(lunarNewYear)).thenReturn(true);

        assertThat(calendar.isHoliday(lunarNewYear)).isTrue();
        assertThat(calendar.isTradingDay(lunarNewYear)).isFalse();
    }

    @Test
    void ordinaryWeekdayIsATradingDay() {
        LocalDate friday = LocalDate.of(2024, 3, 1);
        when(holidayScheduleRepository.existsById(friday)).thenReturn(false);

        assertThat(calendar.isTradingDay(friday)).isTrue();
    }

    @Test
    void holidaysOfAYearSpanTheWholeYear() {
        calendar.getHolidays(2024);

        verify(holidayScheduleRepository).findByDateBetweenOrderByDateAsc(
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31));
    }
}
