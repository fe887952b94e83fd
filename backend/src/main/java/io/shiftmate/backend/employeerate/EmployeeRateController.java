package io.shiftmate.backend.employeerate;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/employee-rates")
public class EmployeeRateController {

  private final EmployeeRateService employeeRateService;

  public EmployeeRateController(EmployeeRateService employeeRateService) {
    this.employeeRateService = employeeRateService;
  }

  /** Returns the stored rates, or all-zero rates when the user has none configured. */
  @GetMapping("/{userId}")
  public ResponseEntity<EmployeeRateResponse> getRate(@PathVariable Long userId) {
    var stored = employeeRateService.findRate(userId);
    var rates =
        stored.map(EmployeeRate::toRates).orElseGet(() -> employeeRateService.ratesFor(userId));
    return ResponseEntity.ok(
        EmployeeRateResponse.from(
            userId,
            stored.map(EmployeeRate::getCompanyId).orElse(null),
            rates,
            stored.isPresent()));
  }

  @PutMapping("/{userId}")
  public ResponseEntity<EmployeeRateResponse> upsertRate(
      @PathVariable Long userId, @Valid @RequestBody UpsertEmployeeRateRequest request) {
    var rate =
        employeeRateService.upsertRate(
            userId,
            request.companyId(),
            new EmployeeRates(
                request.weekdayRate(),
                request.weeknightRate(),
                request.saturdayRate(),
                request.sundayRate(),
                request.publicHolidayRate(),
                request.currency()));
    return ResponseEntity.ok(
        EmployeeRateResponse.from(userId, rate.getCompanyId(), rate.toRates(), true));
  }

  @DeleteMapping("/{userId}")
  public ResponseEntity<Void> deleteRate(@PathVariable Long userId) {
    employeeRateService.deleteRate(userId);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record UpsertEmployeeRateRequest(
      @NotNull(message = "companyId is required") Long companyId,
      @PositiveOrZero long weekdayRate,
      @PositiveOrZero long weeknightRate,
      @PositiveOrZero long saturdayRate,
      @PositiveOrZero long sundayRate,
      @PositiveOrZero long publicHolidayRate,
      @NotNull(message = "currency is required")
          @Size(min = 3, max = 3, message = "currency must be exactly 3 characters")
          String currency) {}

  public record EmployeeRateResponse(
      Long userId,
      Long companyId,
      long weekdayRate,
      long weeknightRate,
      long saturdayRate,
      long sundayRate,
      long publicHolidayRate,
      String currency,
      boolean configured) {

    public static EmployeeRateResponse from(
        Long userId, Long companyId, EmployeeRates rates, boolean configured) {
      return new EmployeeRateResponse(
          userId,
          companyId,
          rates.weekdayRate(),
          rates.weeknightRate(),
          rates.saturdayRate(),
          rates.sundayRate(),
          rates.publicHolidayRate(),
          rates.currency(),
          configured);
    }
  }
}
