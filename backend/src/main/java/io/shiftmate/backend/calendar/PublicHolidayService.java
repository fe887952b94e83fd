package io.shiftmate.backend.calendar;

import io.shiftmate.backend.exception.ResourceConflictException;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PublicHolidayService {

  private static final Logger log = LoggerFactory.getLogger(PublicHolidayService.class);

  private final PublicHolidayRepository publicHolidayRepository;

  public PublicHolidayService(PublicHolidayRepository publicHolidayRepository) {
    this.publicHolidayRepository = publicHolidayRepository;
  }

  /**
   * Loads the global holiday calendar as an immutable set. Holidays are not company-scoped. Callers
   * billing many shifts load this once and share it across every calculation of the request.
   */
  @Transactional(readOnly = true)
  public Set<LocalDate> holidayDates() {
    return Set.copyOf(publicHolidayRepository.findAllDates());
  }

  @Transactional(readOnly = true)
  public List<PublicHoliday> listHolidays() {
    return publicHolidayRepository.findAllByOrderByDateAsc();
  }

  @Transactional
  public PublicHoliday createHoliday(LocalDate date, String description) {
    if (publicHolidayRepository.existsByDate(date)) {
      throw new ResourceConflictException(
          "Duplicate public holiday", "A public holiday already exists on " + date);
    }
    var holiday = publicHolidayRepository.save(new PublicHoliday(date, description));
    log.info("Created public holiday {} on {}", holiday.getId(), date);
    return holiday;
  }
}
