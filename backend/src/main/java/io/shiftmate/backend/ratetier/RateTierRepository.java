package io.shiftmate.backend.ratetier;

import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RateTierRepository extends JpaRepository<RateTier, Long> {

  /**
   * Finds the tiers of a company's rate card for a shift type and day type that are in force on the
   * given date. A null {@code validFrom} or {@code validTo} leaves that side of the window open.
   * Results are ordered by tierOrder ascending, the order in which hours are consumed.
   */
  @Query(
      """
      SELECT rt FROM RateTier rt
      WHERE rt.companyId = :companyId
        AND rt.shiftType = :shiftType
        AND rt.dayType = :dayType
        AND (rt.validFrom IS NULL OR rt.validFrom <= :date)
        AND (rt.validTo IS NULL OR rt.validTo >= :date)
      ORDER BY rt.tierOrder ASC
      """)
  List<RateTier> findApplicable(
      @Param("companyId") Long companyId,
      @Param("shiftType") String shiftType,
      @Param("dayType") String dayType,
      @Param("date") LocalDate date);

  List<RateTier> findByCompanyIdAndShiftTypeAndDayTypeOrderByTierOrderAsc(
      Long companyId, String shiftType, String dayType);

  List<RateTier> findByCompanyIdOrderByShiftTypeAscDayTypeAscTierOrderAsc(Long companyId);
}
