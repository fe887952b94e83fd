package io.shiftmate.backend.ratetier;

import io.shiftmate.backend.calendar.DayCategory;
import io.shiftmate.backend.exception.InvalidStateException;
import io.shiftmate.backend.exception.ResourceConflictException;
import io.shiftmate.backend.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RateTierService {

  private static final Logger log = LoggerFactory.getLogger(RateTierService.class);
  private static final LocalDate FAR_PAST = LocalDate.of(1, 1, 1);
  private static final LocalDate FAR_FUTURE = LocalDate.of(9999, 12, 31);

  private final RateTierRepository rateTierRepository;

  public RateTierService(RateTierRepository rateTierRepository) {
    this.rateTierRepository = rateTierRepository;
  }

  /**
   * A rate card whose bounded tiers have no unlimited tier after them. Hours beyond {@code
   * boundedHours} on such a card are not billed.
   */
  public record CoverageGap(
      String shiftType,
      String dayType,
      LocalDate validFrom,
      LocalDate validTo,
      BigDecimal boundedHours) {}

  /**
   * Creates a tier after checking it against the tiers of the same company, shift type and day type
   * whose validity windows overlap the new one:
   *
   * <ul>
   *   <li>tierOrder must be unique within the card
   *   <li>only one tier may be unlimited, and it must have the highest tierOrder
   * </ul>
   */
  @Transactional
  public RateTier createTier(
      Long companyId,
      String shiftType,
      String dayType,
      int tierOrder,
      BigDecimal hoursInTier,
      long ratePerHour,
      String currency,
      LocalDate validFrom,
      LocalDate validTo) {

    var category =
        DayCategory.fromLabel(dayType)
            .orElseThrow(
                () ->
                    new InvalidStateException(
                        "Invalid day type",
                        "dayType must be one of weekday, weeknight, saturday, sunday, holiday"));
    validateBand(tierOrder, hoursInTier, ratePerHour, validFrom, validTo);

    var card = overlappingCard(companyId, shiftType, category.label(), validFrom, validTo);
    for (RateTier existing : card) {
      if (existing.getTierOrder() == tierOrder) {
        throw new ResourceConflictException(
            "Duplicate tier order",
            "Tier " + tierOrder + " already exists for this shift type, day type and date range");
      }
      if (existing.isUnlimited() && hoursInTier == null) {
        throw new ResourceConflictException(
            "Duplicate unlimited tier",
            "Only one tier without an hour limit is allowed per shift type and day type");
      }
      if (existing.isUnlimited() && existing.getTierOrder() < tierOrder) {
        throw new InvalidStateException(
            "Tier after unlimited tier",
            "Tier "
                + existing.getTierOrder()
                + " has no hour limit, so no tier may follow it");
      }
      if (hoursInTier == null && existing.getTierOrder() > tierOrder) {
        throw new InvalidStateException(
            "Unlimited tier must be last",
            "A tier without an hour limit must have the highest tier order");
      }
    }

    var tier =
        rateTierRepository.save(
            new RateTier(
                companyId,
                shiftType,
                category.label(),
                tierOrder,
                hoursInTier,
                ratePerHour,
                currency,
                validFrom,
                validTo));

    log.info(
        "Created rate tier {} for company {} shiftType={} dayType={} order={}",
        tier.getId(),
        companyId,
        shiftType,
        category.label(),
        tierOrder);
    if (category == DayCategory.WEEKNIGHT) {
      log.warn(
          "Rate tier {} for company {} uses dayType=weeknight; tiered billing prices weekday shifts"
              + " as weekday, so only employee rates distinguish weeknight hours",
          tier.getId(),
          companyId);
    }
    warnOnCoverageGaps(companyId);
    return tier;
  }

  @Transactional
  public void deleteTier(Long id) {
    var tier =
        rateTierRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("RateTier", id));
    rateTierRepository.delete(tier);
    log.info("Deleted rate tier {} for company {}", id, tier.getCompanyId());
    warnOnCoverageGaps(tier.getCompanyId());
  }

  @Transactional(readOnly = true)
  public List<RateTier> listTiers(Long companyId) {
    return rateTierRepository.findByCompanyIdOrderByShiftTypeAscDayTypeAscTierOrderAsc(companyId);
  }

  /**
   * Lists the company's rate cards that end in a bounded tier. A card is the set of tiers sharing a
   * shift type, day type and validity window.
   */
  @Transactional(readOnly = true)
  public List<CoverageGap> coverageGaps(Long companyId) {
    var cards = new LinkedHashMap<CardKey, List<RateTier>>();
    for (RateTier tier : listTiers(companyId)) {
      var key =
          new CardKey(
              tier.getShiftType(), tier.getDayType(), tier.getValidFrom(), tier.getValidTo());
      cards.computeIfAbsent(key, k -> new ArrayList<>()).add(tier);
    }

    var gaps = new ArrayList<CoverageGap>();
    for (List<RateTier> card : cards.values()) {
      if (card.stream().anyMatch(RateTier::isUnlimited)) {
        continue;
      }
      var first = card.get(0);
      var bounded =
          card.stream().map(RateTier::getHoursInTier).reduce(BigDecimal.ZERO, BigDecimal::add);
      gaps.add(
          new CoverageGap(
              first.getShiftType(),
              first.getDayType(),
              first.getValidFrom(),
              first.getValidTo(),
              bounded));
    }
    return gaps;
  }

  private record CardKey(
      String shiftType, String dayType, LocalDate validFrom, LocalDate validTo) {}

  private void validateBand(
      int tierOrder,
      BigDecimal hoursInTier,
      long ratePerHour,
      LocalDate validFrom,
      LocalDate validTo) {
    if (tierOrder < 1) {
      throw new InvalidStateException("Invalid tier order", "tierOrder must be 1 or greater");
    }
    if (ratePerHour < 0) {
      throw new InvalidStateException("Invalid rate", "ratePerHour must not be negative");
    }
    if (hoursInTier != null && hoursInTier.signum() <= 0) {
      throw new InvalidStateException(
          "Invalid tier hours", "hoursInTier must be positive, or omitted for an unlimited tier");
    }
    if (validFrom != null && validTo != null && validFrom.isAfter(validTo)) {
      throw new InvalidStateException(
          "Invalid validity window", "validFrom must not be after validTo");
    }
  }

  private List<RateTier> overlappingCard(
      Long companyId, String shiftType, String dayType, LocalDate validFrom, LocalDate validTo) {
    LocalDate from = Objects.requireNonNullElse(validFrom, FAR_PAST);
    LocalDate to = Objects.requireNonNullElse(validTo, FAR_FUTURE);
    return rateTierRepository
        .findByCompanyIdAndShiftTypeAndDayTypeOrderByTierOrderAsc(companyId, shiftType, dayType)
        .stream()
        .filter(
            t ->
                !Objects.requireNonNullElse(t.getValidFrom(), FAR_PAST).isAfter(to)
                    && !Objects.requireNonNullElse(t.getValidTo(), FAR_FUTURE).isBefore(from))
        .toList();
  }

  private void warnOnCoverageGaps(Long companyId) {
    for (CoverageGap gap : coverageGaps(companyId)) {
      log.warn(
          "Rate card for company {} shiftType={} dayType={} has no unlimited tier; hours beyond {}"
              + " will not be billed",
          companyId,
          gap.shiftType(),
          gap.dayType(),
          gap.boundedHours());
    }
  }
}
