package io.shiftmate.backend.employeerate;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EmployeeRateRepository extends JpaRepository<EmployeeRate, Long> {

  /** The most recently created rate row of a user; older rows are superseded. */
  Optional<EmployeeRate> findFirstByUserIdOrderByIdDesc(Long userId);
}
