package io.shiftmate.backend.ratetier;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One band of a company's tiered rate card for a (shift type, day type) pair. Bands are consumed in
 * ascending {@code tierOrder}; a band without {@code hoursInTier} absorbs all remaining hours.
 */
@Entity
@Table(name = "rate_tiers")
public class RateTier {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "company_id", nullable = false)
  private Long companyId;

  @Column(name = "shift_type", nullable = false)
  private String shiftType;

  @Column(name = "day_type", nullable = false)
  private String dayType;

  @Column(name = "tier_order", nullable = false)
  private int tierOrder;

  @Column(name = "hours_in_tier", precision = 5, scale = 2)
  private BigDecimal hoursInTier;

  @Column(name = "rate_per_hour", nullable = false)
  private long ratePerHour;

  @Column(name = "currency", length = 3)
  private String currency;

  @Column(name = "valid_from")
  private LocalDate validFrom;

  @Column(name = "valid_to")
  private LocalDate validTo;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected RateTier() {}

  public RateTier(
      Long companyId,
      String shiftType,
      String dayType,
      int tierOrder,
      BigDecimal hoursInTier,
      long ratePerHour,
      String currency,
      LocalDate validFrom,
      LocalDate validTo) {
    this.companyId = companyId;
    this.shiftType = shiftType;
    this.dayType = dayType;
    this.tierOrder = tierOrder;
    this.hoursInTier = hoursInTier;
    this.ratePerHour = ratePerHour;
    this.currency = currency;
    this.validFrom = validFrom;
    this.validTo = validTo;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public boolean isUnlimited() {
    return hoursInTier == null;
  }

  public Long getId() {
    return id;
  }

  public Long getCompanyId() {
    return companyId;
  }

  public String getShiftType() {
    return shiftType;
  }

  public String getDayType() {
    return dayType;
  }

  public int getTierOrder() {
    return tierOrder;
  }

  public BigDecimal getHoursInTier() {
    return hoursInTier;
  }

  public long getRatePerHour() {
    return ratePerHour;
  }

  public String getCurrency() {
    return currency;
  }

  public LocalDate getValidFrom() {
    return validFrom;
  }

  public LocalDate getValidTo() {
    return validTo;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
