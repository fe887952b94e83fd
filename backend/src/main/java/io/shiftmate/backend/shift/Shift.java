package io.shiftmate.backend.shift;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A worked or rostered shift. Owned by the roster subsystem; the billing engine only reads it.
 */
@Entity
@Table(name = "shifts")
public class Shift {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "user_id", nullable = false)
  private Long userId;

  @Column(name = "company_id")
  private Long companyId;

  @Column(name = "date", nullable = false)
  private LocalDate date;

  @Column(name = "start_time", nullable = false)
  private LocalTime startTime;

  @Column(name = "end_time", nullable = false)
  private LocalTime endTime;

  @Column(name = "shift_type", nullable = false)
  private String shiftType;

  @Column(name = "status")
  private String status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Shift() {}

  public Shift(
      Long userId,
      Long companyId,
      LocalDate date,
      LocalTime startTime,
      LocalTime endTime,
      String shiftType) {
    this.userId = userId;
    this.companyId = companyId;
    this.date = date;
    this.startTime = startTime;
    this.endTime = endTime;
    this.shiftType = shiftType;
    this.status = "completed";
    this.createdAt = Instant.now();
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

  public LocalDate getDate() {
    return date;
  }

  public LocalTime getStartTime() {
    return startTime;
  }

  public LocalTime getEndTime() {
    return endTime;
  }

  public String getShiftType() {
    return shiftType;
  }

  public String getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
