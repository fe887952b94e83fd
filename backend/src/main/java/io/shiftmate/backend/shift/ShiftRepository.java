package io.shiftmate.backend.shift;

import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ShiftRepository extends JpaRepository<Shift, Long> {

  /** Shifts a user worked within an inclusive date range, in roster order. */
  List<Shift> findByUserIdAndDateBetweenOrderByDateAscStartTimeAsc(
      Long userId, LocalDate from, LocalDate to);
}
