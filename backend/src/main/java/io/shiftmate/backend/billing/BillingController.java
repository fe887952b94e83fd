package io.shiftmate.backend.billing;

import io.shiftmate.backend.shift.BillableShift;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/billing")
public class BillingController {

  private final ShiftBillingService shiftBillingService;

  public BillingController(ShiftBillingService shiftBillingService) {
    this.shiftBillingService = shiftBillingService;
  }

  @PostMapping("/calculate")
  public ResponseEntity<ShiftBilling> calculate(@Valid @RequestBody CalculateRequest request) {
    var shift =
        BillableShift.of(
            request.shiftId(),
            request.userId(),
            request.companyId(),
            request.date(),
            request.startTime(),
            request.endTime(),
            request.shiftType());
    var mode = request.mode() != null ? request.mode() : BillingMode.TIERED;
    return ResponseEntity.ok(shiftBillingService.billAdHoc(shift, mode));
  }

  @GetMapping("/shifts/{shiftId}")
  public ResponseEntity<ShiftBilling> billShift(
      @PathVariable Long shiftId,
      @RequestParam(defaultValue = "TIERED") BillingMode mode) {
    return ResponseEntity.ok(shiftBillingService.billStoredShift(shiftId, mode));
  }

  // --- DTOs ---

  public record CalculateRequest(
      Long shiftId,
      Long userId,
      Long companyId,
      @NotNull(message = "date is required") LocalDate date,
      @NotBlank(message = "startTime is required") String startTime,
      @NotBlank(message = "endTime is required") String endTime,
      @NotBlank(message = "shiftType is required") String shiftType,
      BillingMode mode) {}
}
