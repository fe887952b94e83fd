package io.shiftmate.backend.calendar;

import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface PublicHolidayRepository extends JpaRepository<PublicHoliday, Long> {

  List<PublicHoliday> findAllByOrderByDateAsc();

  boolean existsByDate(LocalDate date);

  @Query("SELECT ph.date FROM PublicHoliday ph")
  List<LocalDate> findAllDates();
}
