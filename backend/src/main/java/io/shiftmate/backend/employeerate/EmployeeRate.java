package io.shiftmate.backend.employeerate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** Flat per-category pay rates of one employee, in cents per hour. */
@Entity
@Table(name = "employee_rates")
public class EmployeeRate {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "user_id", nullable = false)
  private Long userId;

  @Column(name = "company_id", nullable = false)
  private Long companyId;

  @Column(name = "weekday_rate", nullable = false)
  private long weekdayRate;

  @Column(name = "weeknight_rate", nullable = false)
  private long weeknightRate;

  @Column(name = "saturday_rate", nullable = false)
  private long saturdayRate;

  @Column(name = "sunday_rate", nullable = false)
  private long sundayRate;

  @Column(name = "public_holiday_rate", nullable = false)
  private long publicHolidayRate;

  @Column(name = "currency", length = 3)
  private String currency;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected EmployeeRate() {}

  public EmployeeRate(Long userId, Long companyId, EmployeeRates rates) {
    this.userId = userId;
    this.companyId = companyId;
    apply(rates);
    this.createdAt = Instant.now();
  }

  public void update(Long companyId, EmployeeRates rates) {
    this.companyId = companyId;
    apply(rates);
  }

  private void apply(EmployeeRates rates) {
    this.weekdayRate = rates.weekdayRate();
    this.weeknightRate = rates.weeknightRate();
    this.saturdayRate = rates.saturdayRate();
    this.sundayRate = rates.sundayRate();
    this.publicHolidayRate = rates.publicHolidayRate();
    this.currency = rates.currency();
    this.updatedAt = Instant.now();
  }

  public EmployeeRates toRates() {
    return new EmployeeRates(
        weekdayRate, weeknightRate, saturdayRate, sundayRate, publicHolidayRate, currency);
  }

  public Long getId() {
    return id;
  }

  public Long getUserId() {
    return userId;
  }

  public Long getCompanyId() {
    return companyId;
  }

  public long getWeekdayRate() {
    return weekdayRate;
  }

  public long getWeeknightRate() {
    return weeknightRate;
  }

  public long getSaturdayRate() {
    return saturdayRate;
  }

  public long getSundayRate() {
    return sundayRate;
  }

  public long getPublicHolidayRate() {
    return publicHolidayRate;
  }

  public String getCurrency() {
    return currency;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
