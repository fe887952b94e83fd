package io.shiftmate.backend.ratetier;

import io.shiftmate.backend.calendar.DayCategory;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RateTierResolver {

  private static final Logger log = LoggerFactory.getLogger(RateTierResolver.class);

  private final RateTierRepository rateTierRepository;

  public RateTierResolver(RateTierRepository rateTierRepository) {
    this.rateTierRepository = rateTierRepository;
  }

  /**
   * Returns the tiers that apply to a shift, ordered by tierOrder. An empty list means the caller
   * bills at the fallback rate; shifts without a company never match a rate card.
   */
  public List<RateTier> resolve(
      Long companyId, String shiftType, DayCategory dayType, LocalDate shiftDate) {
    if (companyId == null) {
      return List.of();
    }
    var tiers =
        rateTierRepository.findApplicable(companyId, shiftType, dayType.label(), shiftDate);
    log.debug(
        "Resolved {} rate tiers for company={} shiftType={} dayType={} date={}",
        tiers.size(),
        companyId,
        shiftType,
        dayType.label(),
        shiftDate);
    return tiers;
  }
}
